package com.leo.calibratehcp;

/**
 * Forward complex DFT in double precision for arbitrary lengths.
 * <p>
 * Power-of-two lengths use an iterative radix-2 transform; every other length goes through
 * Bluestein's chirp-z reformulation on a padded power-of-two convolution, so an image keeps
 * its own resolution instead of being padded the way {@link ij.process.FHT} requires.
 * Sign convention: {@code X[k] = sum x[n] exp(-2 pi i n k / N)}, unscaled.
 */
final class Fourier {

    private Fourier() {
    }

    /** In-place forward 2D transform of a row-major {@code width x height} complex plane. */
    static void transform2D(double[] re, double[] im, int width, int height) {
        if (re.length != width * height || im.length != width * height) {
            throw new IllegalArgumentException("Plane size does not match " + width + "x" + height);
        }
        double[] rowRe = new double[width];
        double[] rowIm = new double[width];
        for (int y = 0; y < height; y++) {
            System.arraycopy(re, y * width, rowRe, 0, width);
            System.arraycopy(im, y * width, rowIm, 0, width);
            transform(rowRe, rowIm);
            System.arraycopy(rowRe, 0, re, y * width, width);
            System.arraycopy(rowIm, 0, im, y * width, width);
        }
        double[] colRe = new double[height];
        double[] colIm = new double[height];
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                colRe[y] = re[y * width + x];
                colIm[y] = im[y * width + x];
            }
            transform(colRe, colIm);
            for (int y = 0; y < height; y++) {
                re[y * width + x] = colRe[y];
                im[y * width + x] = colIm[y];
            }
        }
    }

    /** In-place forward 1D transform. */
    static void transform(double[] re, double[] im) {
        int n = re.length;
        if (n != im.length) throw new IllegalArgumentException("Mismatched lengths");
        if (n <= 1) return;
        if (isPowerOfTwo(n)) {
            radix2(re, im);
        } else {
            bluestein(re, im);
        }
    }

    static boolean isPowerOfTwo(int n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    private static void radix2(double[] re, double[] im) {
        int n = re.length;
        int levels = Integer.numberOfTrailingZeros(n);
        for (int i = 0; i < n; i++) {
            int j = Integer.reverse(i) >>> (32 - levels);
            if (j > i) {
                double t = re[i]; re[i] = re[j]; re[j] = t;
                t = im[i]; im[i] = im[j]; im[j] = t;
            }
        }
        for (int size = 2; size <= n; size *= 2) {
            int half = size / 2;
            double step = -2 * Math.PI / size;
            for (int k = 0; k < half; k++) {
                double wr = Math.cos(step * k);
                double wi = Math.sin(step * k);
                for (int start = 0; start < n; start += size) {
                    int a = start + k;
                    int b = a + half;
                    double tr = re[b] * wr - im[b] * wi;
                    double ti = re[b] * wi + im[b] * wr;
                    re[b] = re[a] - tr;
                    im[b] = im[a] - ti;
                    re[a] += tr;
                    im[a] += ti;
                }
            }
        }
    }

    private static void bluestein(double[] re, double[] im) {
        int n = re.length;
        int m = Integer.highestOneBit(2 * n - 1);
        if (m < 2 * n - 1) m *= 2;

        // chirp w[k] = exp(-i pi k^2 / n); k^2 taken mod 2n keeps the angle small
        double[] cosTable = new double[n];
        double[] sinTable = new double[n];
        for (int k = 0; k < n; k++) {
            long kk = ((long) k * k) % (2L * n);
            double angle = Math.PI * kk / n;
            cosTable[k] = Math.cos(angle);
            sinTable[k] = Math.sin(angle);
        }

        double[] aRe = new double[m];
        double[] aIm = new double[m];
        for (int k = 0; k < n; k++) {
            aRe[k] = re[k] * cosTable[k] + im[k] * sinTable[k];
            aIm[k] = -re[k] * sinTable[k] + im[k] * cosTable[k];
        }
        double[] bRe = new double[m];
        double[] bIm = new double[m];
        bRe[0] = cosTable[0];
        bIm[0] = sinTable[0];
        for (int k = 1; k < n; k++) {
            bRe[k] = bRe[m - k] = cosTable[k];
            bIm[k] = bIm[m - k] = sinTable[k];
        }

        radix2(aRe, aIm);
        radix2(bRe, bIm);
        for (int i = 0; i < m; i++) {
            double r = aRe[i] * bRe[i] - aIm[i] * bIm[i];
            double s = aRe[i] * bIm[i] + aIm[i] * bRe[i];
            aRe[i] = r;
            aIm[i] = s;
        }
        // inverse via conjugation
        for (int i = 0; i < m; i++) aIm[i] = -aIm[i];
        radix2(aRe, aIm);
        for (int i = 0; i < m; i++) {
            aRe[i] /= m;
            aIm[i] = -aIm[i] / m;
        }

        for (int k = 0; k < n; k++) {
            re[k] = aRe[k] * cosTable[k] + aIm[k] * sinTable[k];
            im[k] = -aRe[k] * sinTable[k] + aIm[k] * cosTable[k];
        }
    }
}
