package edu.cwru.neymanpearsontesting.simulation;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.testng.Assert;
import org.testng.annotations.Test;

public final class RunTulipExampleUnitTest {

    private static String run(final String... args) {
        final PrintStream original = System.out;
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        System.setOut(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        try {
            RunTulipExample.main(args);
        } finally {
            System.setOut(original);
        }
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testDefaultBudget() {
        final String output = run();
        Assert.assertTrue(output.startsWith("region, size, power, dominated?, LRT?"), output);
        Assert.assertTrue(output.contains("Most powerful LRT with size <= 0.15: (0, 1, 2), "), output);
    }

    @Test
    public void testBudgetFromArguments() {
        final String output = run("0.02");
        Assert.assertTrue(output.contains("Most powerful LRT with size <= 0.02: (0, 1), "), output);
    }
}
