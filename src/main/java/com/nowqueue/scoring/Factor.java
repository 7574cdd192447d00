package com.nowqueue.scoring;

/**
 * One additive term of a task score.
 *
 * @param name         Factor name
 * @param rawValue     Value before weighting
 * @param weight       Coefficient from configuration
 * @param contribution {@code rawValue * weight}
 */
public record Factor(String name, double rawValue, double weight, double contribution) {

    public static Factor of(String name, double rawValue, double weight) {
        return new Factor(name, rawValue, weight, rawValue * weight);
    }
}
