package com.codeprism.cli;

import com.codeprism.core.parser.AstParser;
import com.codeprism.core.parser.MalformedSourceException;
import com.codeprism.core.parser.PythonParser;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check that source files parse, without analyzing them.
 */
@Command(
    name = "validate",
    description = "Check that Python source files parse",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Python source files to validate")
    private List<Path> files;

    @Override
    public Integer call() {
        AstParser parser = new PythonParser();
        int failed = 0;

        for (Path file : files) {
            log.debug("Validating: {}", file);
            try {
                parser.parseString(SourceFiles.read(file));
                System.out.println(file + ": OK");
            } catch (MalformedSourceException e) {
                System.out.println(SourceFiles.describe(file, e));
                failed++;
            } catch (IOException e) {
                System.out.println(file + ": cannot read file: " + e.getMessage());
                failed++;
            }
        }

        log.info("Validated {} file(s), {} invalid", files.size(), failed);
        return failed == 0 ? 0 : 1;
    }
}
