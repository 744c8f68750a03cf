package com.elis.analysis.model;

public enum ImageSource {
    UPLOADED,
    EXTRACTED
}
