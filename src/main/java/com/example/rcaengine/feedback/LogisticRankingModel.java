package com.example.rcaengine.feedback;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;

/**
 * L2-regularized logistic regression over standardized features. Scores are
 * the predicted probability that a suspect is the true cause.
 */
@Getter
public class LogisticRankingModel {

    private final List<String> featureNames;
    private final double[] means;
    private final double[] scales;
    private final double[] weights;
    private final double bias;

    @JsonCreator
    public LogisticRankingModel(@JsonProperty("featureNames") List<String> featureNames,
                                @JsonProperty("means") double[] means,
                                @JsonProperty("scales") double[] scales,
                                @JsonProperty("weights") double[] weights,
                                @JsonProperty("bias") double bias) {
        int n = featureNames.size();
        if (means.length != n || scales.length != n || weights.length != n) {
            throw new IllegalArgumentException("Parameter arity does not match " + n + " features");
        }
        this.featureNames = List.copyOf(featureNames);
        this.means = means.clone();
        this.scales = scales.clone();
        this.weights = weights.clone();
        this.bias = bias;
    }

    public double score(double[] features) {
        if (features.length != weights.length) {
            throw new IllegalArgumentException("Expected " + weights.length + " features, got " + features.length);
        }
        double z = bias;
        for (int i = 0; i < features.length; i++) {
            z += weights[i] * (features[i] - means[i]) / scales[i];
        }
        return sigmoid(z);
    }

    /**
     * Batch gradient descent on the regularized log loss. The bias is not
     * regularized. Deterministic for a given input order.
     */
    public static LogisticRankingModel fit(List<String> featureNames, List<double[]> x, List<Integer> y,
                                           int iterations, double learningRate, double l2) {
        if (x.isEmpty() || x.size() != y.size()) {
            throw new IllegalArgumentException("Training set is empty or misaligned");
        }
        int n = featureNames.size();
        int m = x.size();

        double[] means = new double[n];
        double[] scales = new double[n];
        for (double[] row : x) {
            for (int j = 0; j < n; j++) means[j] += row[j] / m;
        }
        for (double[] row : x) {
            for (int j = 0; j < n; j++) scales[j] += (row[j] - means[j]) * (row[j] - means[j]) / m;
        }
        for (int j = 0; j < n; j++) {
            scales[j] = scales[j] > 1e-12 ? Math.sqrt(scales[j]) : 1.0;
        }

        double[][] standardized = new double[m][n];
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < n; j++) standardized[i][j] = (x.get(i)[j] - means[j]) / scales[j];
        }

        double[] weights = new double[n];
        double bias = 0.0;
        for (int iter = 0; iter < iterations; iter++) {
            double[] gradient = new double[n];
            double biasGradient = 0.0;
            for (int i = 0; i < m; i++) {
                double z = bias;
                for (int j = 0; j < n; j++) z += weights[j] * standardized[i][j];
                double error = sigmoid(z) - y.get(i);
                for (int j = 0; j < n; j++) gradient[j] += error * standardized[i][j];
                biasGradient += error;
            }
            for (int j = 0; j < n; j++) {
                weights[j] -= learningRate * (gradient[j] / m + l2 * weights[j]);
            }
            bias -= learningRate * biasGradient / m;
        }
        return new LogisticRankingModel(featureNames, means, scales, weights, bias);
    }

    private static double sigmoid(double z) {
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }

    @Override
    public String toString() {
        return "LogisticRankingModel{features=" + featureNames + ", weights=" + Arrays.toString(weights)
                + ", bias=" + bias + '}';
    }
}
