package com.elis.analysis.tool;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code trufor}: writes a localization map ({@code pred_map}), a confidence map ({@code conf_map})
 * and, with {@code --save_np}, the noiseprint.
 */
public class TamperDetectionContract extends AbstractToolContract {

    public static final String NAME = "trufor";
    public static final String INPUT_ROLE = "input_image";
    public static final String SAVE_NOISEPRINT = "save_noiseprint";

    public TamperDetectionContract() {
        super(NAME, INPUT_ROLE,
                List.of(new OptionSpec(SAVE_NOISEPRINT, Set.of("true", "false"), "false")),
                Set.of("png", "jpg", "npz"));
    }

    @Override
    public List<String> arguments(Path input, Map<String, String> options) {
        List<String> args = new ArrayList<>(List.of("-in", containerInput(input), "-out", OUTPUT_MOUNT));
        if (Boolean.parseBoolean(options.get(SAVE_NOISEPRINT))) {
            args.add("--save_np");
        }
        return args;
    }
}
