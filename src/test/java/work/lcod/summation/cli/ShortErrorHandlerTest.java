package work.lcod.summation.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import work.lcod.summation.runtime.SpecificationException;

class ShortErrorHandlerTest {
    @CommandLine.Command(name = "failing")
    static final class FailingCommand implements Callable<Integer> {
        @Override
        public Integer call() {
            throw new IllegalStateException(
                "Run aborted",
                new SpecificationException(SpecificationException.ILLEGAL_STEP, "REDUCE is not allowed online")
            );
        }
    }

    @Test
    void printsRootCauseWithSpecificationCode() {
        var err = new StringWriter();
        var cli = new CommandLine(new FailingCommand()).setExecutionExceptionHandler(new ShortErrorHandler());
        cli.setErr(new PrintWriter(err, true));

        int exitCode = cli.execute();

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("[illegal_step] REDUCE is not allowed online"));
        assertFalse(err.toString().contains("Run aborted"));
    }
}
