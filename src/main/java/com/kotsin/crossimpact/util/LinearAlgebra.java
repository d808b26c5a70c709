package com.kotsin.crossimpact.util;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Comparator;

/**
 * LinearAlgebra - Small dense routines for the composite OFI and the cross-impact fits.
 *
 * Sizes here are tiny (5x5 covariance, a handful of regressors), so plain arrays and
 * textbook algorithms are enough:
 * - symmetric eigen-decomposition by cyclic Jacobi rotations
 * - least squares by Householder QR with a relative rank check on the R diagonal
 *
 * All routines are pure: inputs are copied, never modified.
 */
public final class LinearAlgebra {

    private LinearAlgebra() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static final int MAX_JACOBI_SWEEPS = 100;

    // ======================== EIGEN-DECOMPOSITION ========================

    /**
     * Eigenvalues (descending) and matching unit eigenvectors of a symmetric matrix.
     */
    @Getter
    @RequiredArgsConstructor
    public static final class EigenDecomposition {
        private final double[] eigenvalues;
        /** vectors[i] is the eigenvector of eigenvalues[i]. */
        private final double[][] eigenvectors;

        public double[] principalVector() {
            return eigenvectors[0].clone();
        }

        public double trace() {
            double sum = 0.0;
            for (double v : eigenvalues) {
                sum += v;
            }
            return sum;
        }
    }

    public static EigenDecomposition symmetricEigen(double[][] matrix) {
        int n = matrix.length;
        double[][] a = new double[n][];
        for (int i = 0; i < n; i++) {
            if (matrix[i].length != n) {
                throw new IllegalArgumentException("Matrix is not square: row " + i + " has " + matrix[i].length + " columns");
            }
            a[i] = matrix[i].clone();
        }
        double[][] v = identity(n);

        double total = 0.0;
        for (double[] row : a) {
            for (double x : row) {
                total += x * x;
            }
        }

        for (int sweep = 0; sweep < MAX_JACOBI_SWEEPS; sweep++) {
            double off = 0.0;
            for (int p = 0; p < n; p++) {
                for (int q = p + 1; q < n; q++) {
                    off += a[p][q] * a[p][q];
                }
            }
            if (off == 0.0 || off <= 1e-30 * total) {
                break;
            }

            for (int p = 0; p < n; p++) {
                for (int q = p + 1; q < n; q++) {
                    if (a[p][q] == 0.0) {
                        continue;
                    }
                    double theta = (a[q][q] - a[p][p]) / (2.0 * a[p][q]);
                    double t = (theta >= 0 ? 1.0 : -1.0) / (Math.abs(theta) + Math.sqrt(theta * theta + 1.0));
                    double c = 1.0 / Math.sqrt(t * t + 1.0);
                    double s = t * c;
                    rotate(a, v, p, q, c, s);
                }
            }
        }

        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        final double[][] diag = a;
        // Stable sort keeps ties in index order
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> diag[i][i]).reversed());

        double[] values = new double[n];
        double[][] vectors = new double[n][n];
        for (int k = 0; k < n; k++) {
            int col = order[k];
            values[k] = a[col][col];
            for (int row = 0; row < n; row++) {
                vectors[k][row] = v[row][col];
            }
        }
        return new EigenDecomposition(values, vectors);
    }

    private static void rotate(double[][] a, double[][] v, int p, int q, double c, double s) {
        int n = a.length;
        for (int k = 0; k < n; k++) {
            double akp = a[k][p];
            double akq = a[k][q];
            a[k][p] = c * akp - s * akq;
            a[k][q] = s * akp + c * akq;
        }
        for (int k = 0; k < n; k++) {
            double apk = a[p][k];
            double aqk = a[q][k];
            a[p][k] = c * apk - s * aqk;
            a[q][k] = s * apk + c * aqk;
        }
        for (int k = 0; k < n; k++) {
            double vkp = v[k][p];
            double vkq = v[k][q];
            v[k][p] = c * vkp - s * vkq;
            v[k][q] = s * vkp + c * vkq;
        }
    }

    // ======================== LEAST SQUARES ========================

    /**
     * Solution of min ||X b - y||. When {@code fullRank} is false, {@code coefficients}
     * is null and {@code deficientColumn} names the first column found dependent.
     */
    @Getter
    @RequiredArgsConstructor
    public static final class LeastSquaresSolution {
        private final boolean fullRank;
        private final double[] coefficients;
        private final int deficientColumn;
    }

    /**
     * @param x         design matrix, rows = observations (m >= p required)
     * @param y         response
     * @param tolerance relative size of |R_kk| against max |R_jj| below which the design is rank deficient
     */
    public static LeastSquaresSolution solveLeastSquares(double[][] x, double[] y, double tolerance) {
        int m = x.length;
        if (m == 0 || m != y.length) {
            throw new IllegalArgumentException("Design has " + m + " rows but response has " + y.length);
        }
        int p = x[0].length;
        if (m < p) {
            throw new IllegalArgumentException("Fewer rows (" + m + ") than columns (" + p + ")");
        }

        double[][] a = new double[m][];
        for (int i = 0; i < m; i++) {
            a[i] = x[i].clone();
        }
        double[] b = y.clone();
        double[] rDiag = new double[p];

        for (int k = 0; k < p; k++) {
            double norm = 0.0;
            for (int i = k; i < m; i++) {
                norm += a[i][k] * a[i][k];
            }
            norm = Math.sqrt(norm);
            if (norm == 0.0) {
                rDiag[k] = 0.0;
                continue;
            }
            double alpha = a[k][k] > 0 ? -norm : norm;
            a[k][k] -= alpha;
            rDiag[k] = alpha;

            double vNorm2 = 0.0;
            for (int i = k; i < m; i++) {
                vNorm2 += a[i][k] * a[i][k];
            }
            if (vNorm2 == 0.0) {
                continue;
            }
            for (int j = k + 1; j < p; j++) {
                double dot = 0.0;
                for (int i = k; i < m; i++) {
                    dot += a[i][k] * a[i][j];
                }
                double f = 2.0 * dot / vNorm2;
                for (int i = k; i < m; i++) {
                    a[i][j] -= f * a[i][k];
                }
            }
            double dot = 0.0;
            for (int i = k; i < m; i++) {
                dot += a[i][k] * b[i];
            }
            double f = 2.0 * dot / vNorm2;
            for (int i = k; i < m; i++) {
                b[i] -= f * a[i][k];
            }
        }

        double maxDiag = 0.0;
        for (double d : rDiag) {
            maxDiag = Math.max(maxDiag, Math.abs(d));
        }
        for (int k = 0; k < p; k++) {
            if (maxDiag == 0.0 || Math.abs(rDiag[k]) <= tolerance * maxDiag) {
                return new LeastSquaresSolution(false, null, k);
            }
        }

        double[] beta = new double[p];
        for (int k = p - 1; k >= 0; k--) {
            double sum = b[k];
            for (int j = k + 1; j < p; j++) {
                sum -= a[k][j] * beta[j];
            }
            beta[k] = sum / rDiag[k];
        }
        return new LeastSquaresSolution(true, beta, -1);
    }

    // ======================== HELPERS ========================

    public static double dot(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector lengths differ: " + a.length + " vs " + b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static double[][] identity(int n) {
        double[][] id = new double[n][n];
        for (int i = 0; i < n; i++) {
            id[i][i] = 1.0;
        }
        return id;
    }
}
