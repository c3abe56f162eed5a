package dev.ionfusion.fuusak.cli;

import dev.ionfusion.fuusak.api.FormatResult;
import java.util.List;

final class Reports {
    private Reports() {}

    static void report(CliReporter reporter, FormatResult result) {
        switch (result.status()) {
            case UNCHANGED -> reporter.debug("Unchanged " + result.fileName());
            case REFORMATTED -> reporter.info("Reformatted " + result.fileName());
            case WOULD_REFORMAT -> reporter.warn("Would reformat " + result.fileName());
            case FAILED -> reporter.error(result.message().orElse("Failed to format " + result.fileName()));
        }
    }

    static String summary(List<FormatResult> results) {
        var counts = new int[FormatResult.Status.values().length];
        results.forEach(result -> counts[result.status().ordinal()]++);
        return String.format(
            "%d file(s) checked: %d reformatted, %d would be reformatted, %d unchanged, %d failed",
            results.size(),
            counts[FormatResult.Status.REFORMATTED.ordinal()],
            counts[FormatResult.Status.WOULD_REFORMAT.ordinal()],
            counts[FormatResult.Status.UNCHANGED.ordinal()],
            counts[FormatResult.Status.FAILED.ordinal()]);
    }
}
