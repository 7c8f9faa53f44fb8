package params.publication;

public record RowNames(String TOTAL_ROW, String QUESTION_ROW) {}
