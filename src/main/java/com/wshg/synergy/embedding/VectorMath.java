package com.wshg.synergy.embedding;

/**
 * 向量计算工具。遍历热路径只做点积，归一化在向量化时一次完成。
 */
public final class VectorMath {

    /** 归一化后范数与 1 的允许误差 */
    public static final double NORM_TOLERANCE = 1e-4;

    private VectorMath() {
    }

    public static double norm(float[] v) {
        double sum = 0;
        for (float x : v) sum += (double) x * x;
        return Math.sqrt(sum);
    }

    /**
     * 返回 L2 归一化后的新数组；零向量无法归一化，抛出 IllegalArgumentException。
     */
    public static float[] normalize(float[] v) {
        double n = norm(v);
        if (n == 0 || Double.isNaN(n) || Double.isInfinite(n)) {
            throw new IllegalArgumentException("向量范数无效: " + n);
        }
        float[] out = new float[v.length];
        for (int i = 0; i < v.length; i++) out[i] = (float) (v[i] / n);
        return out;
    }

    public static double dot(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("向量维度不一致: " + a.length + " != " + b.length);
        }
        double dot = 0;
        for (int i = 0; i < a.length; i++) dot += (double) a[i] * b[i];
        return dot;
    }

    public static boolean isUnitLength(float[] v) {
        return Math.abs(norm(v) - 1.0) <= NORM_TOLERANCE;
    }
}
