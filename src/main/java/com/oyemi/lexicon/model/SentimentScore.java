package com.oyemi.lexicon.model;

/**
 * Positive/negative score pair of one concept, each in [0, 1].
 */
public record SentimentScore(double positive, double negative) {

    public static final SentimentScore NONE = new SentimentScore(0.0, 0.0);

    public SentimentScore {
        if (Double.isNaN(positive) || Double.isNaN(negative)
                || positive < 0.0 || positive > 1.0 || negative < 0.0 || negative > 1.0) {
            throw new IllegalArgumentException("Sentiment scores must lie in [0,1]: " + positive + "/" + negative);
        }
    }
}
