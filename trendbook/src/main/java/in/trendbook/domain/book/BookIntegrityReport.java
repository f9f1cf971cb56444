package in.trendbook.domain.book;

import java.util.List;

/**
 * Result of a book consistency check.
 */
public record BookIntegrityReport(boolean crossed, List<String> problems) {
    public BookIntegrityReport {
        problems = List.copyOf(problems);
    }

    public boolean isValid() {
        return problems.isEmpty();
    }
}
