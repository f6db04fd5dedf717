package com.embeddingstudio.vectordb.common.similarity;

/**
 * Vector math used by the metric model and by exact re-ranking.
 */
public final class VectorSimilarity {

    private VectorSimilarity() {
    }

    /** Скалярное произведение векторов */
    public static double dot(float[] vector1, float[] vector2) {
        requireSameDimension(vector1, vector2);

        double sum = 0.0;
        for (int i = 0; i < vector1.length; i++) {
            sum += (double) vector1[i] * vector2[i];
        }
        return sum;
    }

    /** Евклидова норма вектора */
    public static double norm(float[] vector) {
        double sum = 0.0;
        for (float value : vector) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }

    /** Вычислить евклидово расстояние между векторами */
    public static double euclideanDistance(float[] vector1, float[] vector2) {
        requireSameDimension(vector1, vector2);

        double sum = 0.0;
        for (int i = 0; i < vector1.length; i++) {
            double diff = (double) vector1[i] - vector2[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    /**
     * Cosine similarity in [-1, 1]. A zero vector has similarity 0 with everything.
     */
    public static double cosineSimilarity(float[] vector1, float[] vector2) {
        requireSameDimension(vector1, vector2);

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < vector1.length; i++) {
            dotProduct += (double) vector1[i] * vector2[i];
            normA += (double) vector1[i] * vector1[i];
            normB += (double) vector2[i] * vector2[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static void requireSameDimension(float[] vector1, float[] vector2) {
        if (vector1.length != vector2.length) {
            throw new IllegalArgumentException("Vectors must have the same dimension");
        }
    }
}
