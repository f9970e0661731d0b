package com.oilevels.levels;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Processes a workbook on disk when started with {@code --input=<path>}.
 *
 * <p>The result goes to {@code --output=<path>}, or back over the input file when no output
 * is given. Without {@code --input} the runner does nothing.
 */
@Component
public class LevelsFileRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(LevelsFileRunner.class);

    private final LevelsService levelsService;

    public LevelsFileRunner(LevelsService levelsService) {
        this.levelsService = levelsService;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        Optional<Path> input = firstOption(args, "input").map(Path::of);
        if (input.isEmpty()) {
            return;
        }
        Path output = firstOption(args, "output").map(Path::of).orElse(input.get());

        if (!Files.isRegularFile(input.get())) {
            log.error("File not found: {}", input.get());
            return;
        }

        Optional<byte[]> result = levelsService.process(Files.readAllBytes(input.get()));
        if (result.isPresent()) {
            Files.write(output, result.get());
            log.info("Successfully processed {} -> {}", input.get(), output);
        } else {
            log.error("No output written for {}", input.get());
        }
    }

    private Optional<String> firstOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }
}
