package com.elis.analysis.tool;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code pdf-watermark-removal}: {@code -i <pdf> -o <pdf> -m <1|2|3>}.
 * Mode 1 removes explicit watermarks only, 2 also text and repeated graphics, 3 all graphics.
 */
public class WatermarkRemovalContract extends AbstractToolContract {

    public static final String NAME = "pdf-watermark-removal";
    public static final String INPUT_ROLE = "input_pdf";
    public static final String AGGRESSIVENESS = "aggressiveness";

    public WatermarkRemovalContract() {
        super(NAME, INPUT_ROLE,
                List.of(new OptionSpec(AGGRESSIVENESS, Set.of("1", "2", "3"), "2")),
                Set.of("pdf"));
    }

    @Override
    public List<String> arguments(Path input, Map<String, String> options) {
        String mode = options.get(AGGRESSIVENESS);
        return List.of(
                "-i", containerInput(input),
                "-o", OUTPUT_MOUNT + "/" + outputFilename(input, mode),
                "-m", mode);
    }

    public static String outputFilename(Path input, String mode) {
        return stem(input) + "_watermark_removed_m" + mode + ".pdf";
    }
}
