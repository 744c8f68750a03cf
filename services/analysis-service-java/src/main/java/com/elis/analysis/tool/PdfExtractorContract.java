package com.elis.analysis.tool;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code pdf-extractor}: reads {@code INPUT_PATH}, writes every embedded figure to {@code OUTPUT_PATH}.
 */
public class PdfExtractorContract extends AbstractToolContract {

    public static final String NAME = "pdf-extractor";
    public static final String INPUT_ROLE = "input_pdf";

    public PdfExtractorContract() {
        super(NAME, INPUT_ROLE, List.of(), Set.of("png", "jpg", "jpeg", "gif", "webp", "tiff", "bmp"));
    }

    @Override
    public Map<String, String> environment(Path input, Map<String, String> options) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("INPUT_PATH", containerInput(input));
        env.put("OUTPUT_PATH", OUTPUT_MOUNT);
        return env;
    }

    @Override
    public List<String> arguments(Path input, Map<String, String> options) {
        return List.of();
    }
}
