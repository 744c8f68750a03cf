package com.elis.analysis.model;

public enum SubjectType {
    DOCUMENT,
    IMAGE
}
