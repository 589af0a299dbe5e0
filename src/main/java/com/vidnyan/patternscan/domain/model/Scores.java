package com.vidnyan.patternscan.domain.model;

/**
 * Normalized scores of one analysis. Sub-scores are on a 0-10 scale except
 * quality, which is 0-1.
 */
public record Scores(
    double security,
    double complexity,
    double performance,
    double quality,
    double global
) {
    
    public static final Scores MAXIMUM = new Scores(10.0, 10.0, 10.0, 1.0, 10.0);
    
    /**
     * Letter grade for the global score.
     */
    public String grade() {
        double percent = global * 10.0;
        if (percent >= 95) return "A+";
        if (percent >= 90) return "A";
        if (percent >= 85) return "A-";
        if (percent >= 80) return "B+";
        if (percent >= 75) return "B";
        if (percent >= 70) return "B-";
        if (percent >= 65) return "C+";
        if (percent >= 60) return "C";
        if (percent >= 55) return "C-";
        if (percent >= 50) return "D+";
        if (percent >= 45) return "D";
        if (percent >= 40) return "D-";
        return "F";
    }
}
