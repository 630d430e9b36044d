package com.edabot.output;

import com.edabot.config.EdaConfig;
import com.edabot.config.PlotKind;
import com.edabot.model.Panel;
import com.edabot.stats.SeriesMath;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.AWTError;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Companion PNG charts for the report, drawn with Java2D. A chart that fails
 * is logged and skipped; the rest are still written.
 */
public final class PlotWriter {
    private static final Logger log = LogManager.getLogger(PlotWriter.class);

    static final int ACF_LAGS = 40;

    private static final Color BACKGROUND = new Color(248, 250, 252);
    private static final Color GRID = new Color(220, 226, 236);
    private static final Color AXIS_TEXT = new Color(86, 95, 111);
    private static final Color SERIES = new Color(31, 119, 180);
    private static final Color REFERENCE = new Color(214, 39, 40);

    public List<String> writeAll(EdaConfig config, Panel prices, Panel returns) throws IOException {
        Path dir = config.outputDirs.reports;
        Files.createDirectories(dir);
        List<String> written = new ArrayList<>();

        if (config.plotEnabled(PlotKind.TIMESERIES)) {
            attempt(written, dir, "prices.png", out -> writeSeriesGrid(prices, "Price Series", out));
        }
        if (config.plotEnabled(PlotKind.RETURNS)) {
            attempt(written, dir, "returns.png", out -> writeSeriesGrid(returns, "Returns", out));
        }
        if (config.plotEnabled(PlotKind.HEATMAP)) {
            attempt(written, dir, "corr_heatmap.png", out -> writeCorrelationHeatmap(returns, out));
        }
        List<String> stems = fileStems(returns.columns());
        if (config.plotEnabled(PlotKind.ACF_PACF)) {
            for (int c = 0; c < returns.columnCount(); c++) {
                String series = returns.columns().get(c);
                double[] x = returns.column(c);
                attempt(written, dir, "acf_" + stems.get(c) + ".png", out -> writeAcfPacf(series, x, out));
            }
        }
        if (config.plotEnabled(PlotKind.QQ)) {
            for (int c = 0; c < returns.columnCount(); c++) {
                String series = returns.columns().get(c);
                double[] x = returns.column(c);
                attempt(written, dir, "qq_" + stems.get(c) + ".png", out -> writeQq(series, x, out));
            }
        }
        log.info("Wrote {} plots to {}", written.size(), dir);
        return written;
    }

    static String safeName(String series) {
        return series.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    // Per-series file stems; names that sanitize to the same stem (ignoring case) get _2, _3, ...
    static List<String> fileStems(List<String> series) {
        Set<String> taken = new HashSet<>();
        List<String> stems = new ArrayList<>(series.size());
        for (String name : series) {
            String base = safeName(name);
            String stem = base;
            for (int n = 2; !taken.add(stem.toLowerCase(Locale.ROOT)); n++) {
                stem = base + "_" + n;
            }
            if (!stem.equals(base)) {
                log.warn("Series '{}' clashes with another plot file name; using '{}'", name, stem);
            }
            stems.add(stem);
        }
        return stems;
    }

    private interface Chart {
        void draw(Path out) throws IOException;
    }

    private static void attempt(List<String> written, Path dir, String fileName, Chart chart) {
        try {
            chart.draw(dir.resolve(fileName));
            written.add(fileName);
        } catch (IOException | RuntimeException e) {
            log.warn("Plot {} was not written: {}", fileName, e.toString());
        } catch (LinkageError | InternalError | AWTError e) {
            // headless runtimes without native font or imaging support
            log.warn("Plot {} was not written, graphics unavailable: {}", fileName, e.toString());
        }
    }

    // One panel per series; the grid grows with the number of series.
    static void writeSeriesGrid(Panel panel, String label, Path out) throws IOException {
        int k = panel.columnCount();
        int gridCols = (int) Math.ceil(Math.sqrt(k));
        int gridRows = (int) Math.ceil(k / (double) gridCols);
        int cellW = 520;
        int cellH = 340;
        BufferedImage img = canvas(gridCols * cellW, gridRows * cellH);
        Graphics2D g = img.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        for (int c = 0; c < k; c++) {
            int x0 = (c % gridCols) * cellW;
            int y0 = (c / gridCols) * cellH;
            drawLineChart(g, panel.column(c), panel.columns().get(c) + " - " + label, x0, y0, cellW, cellH);
        }
        g.dispose();
        ImageIO.write(img, "png", out.toFile());
    }

    static void writeCorrelationHeatmap(Panel returns, Path out) throws IOException {
        int k = returns.columnCount();
        double[][] data = new double[returns.rowCount()][k];
        for (int c = 0; c < k; c++) {
            double[] col = returns.column(c);
            for (int r = 0; r < col.length; r++) {
                data[r][c] = col[r];
            }
        }
        RealMatrix corr = new PearsonsCorrelation(data).getCorrelationMatrix();

        int cell = Math.max(60, Math.min(120, 720 / Math.max(1, k)));
        int left = 180;
        int top = 80;
        BufferedImage img = canvas(left + k * cell + 40, top + k * cell + 40);
        Graphics2D g = img.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setColor(Color.BLACK);
        g.setFont(new Font("SansSerif", Font.BOLD, 22));
        g.drawString("Return Correlation Matrix", 20, 40);
        g.setFont(new Font("SansSerif", Font.PLAIN, 14));
        for (int i = 0; i < k; i++) {
            g.setColor(AXIS_TEXT);
            g.drawString(trim(returns.columns().get(i), 20), 10, top + i * cell + cell / 2 + 5);
            for (int j = 0; j < k; j++) {
                double v = corr.getEntry(i, j);
                g.setColor(divergingColor(v));
                g.fillRect(left + j * cell, top + i * cell, cell, cell);
                g.setColor(Color.BLACK);
                g.drawString(ReportFormat.fixed(v, 2), left + j * cell + cell / 2 - 16, top + i * cell + cell / 2 + 5);
            }
        }
        g.dispose();
        ImageIO.write(img, "png", out.toFile());
    }

    static void writeAcfPacf(String series, double[] x, Path out) throws IOException {
        double[] acf = SeriesMath.acf(x, Math.min(ACF_LAGS, x.length - 1));
        if (acf == null) {
            throw new IllegalArgumentException("constant series has no autocorrelation");
        }
        double[] pacf = SeriesMath.pacf(acf);
        double band = 1.96 / Math.sqrt(x.length);
        int width = 1200;
        int height = 800;
        BufferedImage img = canvas(width, height);
        Graphics2D g = img.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        drawBars(g, acf, band, series + " - Autocorrelation Function", 0, 0, width, height / 2);
        drawBars(g, pacf, band, series + " - Partial Autocorrelation Function", 0, height / 2, width, height / 2);
        g.dispose();
        ImageIO.write(img, "png", out.toFile());
    }

    /**
     * Sample order statistics against normal quantiles at Filliben's plotting
     * positions, with a least-squares reference line.
     */
    static void writeQq(String series, double[] x, Path out) throws IOException {
        int n = x.length;
        if (n < 2) {
            throw new IllegalArgumentException("Q-Q plot needs at least two observations");
        }
        double[] sample = x.clone();
        Arrays.sort(sample);
        double[] theoretical = new double[n];
        NormalDistribution normal = new NormalDistribution(0.0, 1.0);
        for (int i = 0; i < n; i++) {
            double m;
            if (i == n - 1) {
                m = Math.pow(0.5, 1.0 / n);
            } else if (i == 0) {
                m = 1.0 - Math.pow(0.5, 1.0 / n);
            } else {
                m = (i + 1 - 0.3175) / (n + 0.365);
            }
            theoretical[i] = normal.inverseCumulativeProbability(m);
        }
        double mt = SeriesMath.mean(theoretical);
        double ms = SeriesMath.mean(sample);
        double sxy = 0.0;
        double sxx = 0.0;
        for (int i = 0; i < n; i++) {
            sxy += (theoretical[i] - mt) * (sample[i] - ms);
            sxx += (theoretical[i] - mt) * (theoretical[i] - mt);
        }
        double slope = sxx == 0.0 ? 0.0 : sxy / sxx;
        double intercept = ms - slope * mt;

        int width = 900;
        int height = 700;
        int left = 90;
        int top = 70;
        int pw = width - left - 40;
        int ph = height - top - 70;
        double xMin = theoretical[0];
        double xMax = theoretical[n - 1];
        double[] yRange = range(sample, intercept + slope * xMin, intercept + slope * xMax);

        BufferedImage img = canvas(width, height);
        Graphics2D g = img.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setColor(Color.BLACK);
        g.setFont(new Font("SansSerif", Font.BOLD, 20));
        g.drawString(series + " - Q-Q Plot vs Normal Distribution", 20, 36);
        g.drawRect(left, top, pw, ph);

        g.setColor(REFERENCE);
        g.setStroke(new BasicStroke(2f));
        g.drawLine(scale(xMin, xMin, xMax, left, pw), toY(intercept + slope * xMin, yRange[0], yRange[1], top, ph),
                scale(xMax, xMin, xMax, left, pw), toY(intercept + slope * xMax, yRange[0], yRange[1], top, ph));
        g.setColor(SERIES);
        for (int i = 0; i < n; i++) {
            int px = scale(theoretical[i], xMin, xMax, left, pw);
            int py = toY(sample[i], yRange[0], yRange[1], top, ph);
            g.fillOval(px - 3, py - 3, 6, 6);
        }
        g.setColor(AXIS_TEXT);
        g.setFont(new Font("SansSerif", Font.PLAIN, 16));
        g.drawString("Theoretical quantiles", left + pw / 2 - 80, top + ph + 40);
        g.drawString(ReportFormat.fixed(yRange[1], 4), 10, top + 12);
        g.drawString(ReportFormat.fixed(yRange[0], 4), 10, top + ph);
        g.dispose();
        ImageIO.write(img, "png", out.toFile());
    }

    private static BufferedImage canvas(int width, int height) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(BACKGROUND);
        g.fillRect(0, 0, width, height);
        g.dispose();
        return img;
    }

    private static void drawLineChart(Graphics2D g, double[] values, String title, int x0, int y0, int w, int h) {
        int left = x0 + 80;
        int top = y0 + 40;
        int pw = w - 100;
        int ph = h - 70;
        double[] r = range(values, Double.NaN, Double.NaN);

        g.setColor(Color.BLACK);
        g.setFont(new Font("SansSerif", Font.BOLD, 15));
        g.drawString(trim(title, 48), x0 + 12, y0 + 24);
        g.drawRect(left, top, pw, ph);
        g.setFont(new Font("SansSerif", Font.PLAIN, 12));
        for (int i = 0; i <= 4; i++) {
            int y = top + (int) Math.round(i / 4.0 * ph);
            g.setColor(GRID);
            g.drawLine(left, y, left + pw, y);
            g.setColor(AXIS_TEXT);
            g.drawString(String.format(Locale.US, "%.4g", r[1] - (r[1] - r[0]) * i / 4.0), x0 + 6, y + 4);
        }

        Path2D path = new Path2D.Double();
        boolean started = false;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                started = false;
                continue;
            }
            int x = toX(i, values.length, left, pw);
            int y = toY(values[i], r[0], r[1], top, ph);
            if (!started) {
                path.moveTo(x, y);
                started = true;
            } else {
                path.lineTo(x, y);
            }
        }
        g.setColor(SERIES);
        g.setStroke(new BasicStroke(1.5f, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
        g.draw(path);
        g.setStroke(new BasicStroke(1f));
    }

    private static void drawBars(Graphics2D g, double[] values, double band, String title,
                                 int x0, int y0, int w, int h) {
        int left = x0 + 70;
        int top = y0 + 50;
        int pw = w - 100;
        int ph = h - 90;
        int zero = toY(0.0, -1.0, 1.0, top, ph);

        g.setColor(Color.BLACK);
        g.setFont(new Font("SansSerif", Font.BOLD, 18));
        g.drawString(title, x0 + 16, y0 + 30);
        g.drawRect(left, top, pw, ph);

        g.setColor(new Color(174, 199, 232));
        int bandTop = toY(band, -1.0, 1.0, top, ph);
        int bandBottom = toY(-band, -1.0, 1.0, top, ph);
        g.fillRect(left + 1, bandTop, pw - 1, Math.max(1, bandBottom - bandTop));
        g.setColor(GRID);
        g.drawLine(left, zero, left + pw, zero);

        g.setColor(SERIES);
        g.setStroke(new BasicStroke(2f));
        for (int lag = 0; lag < values.length; lag++) {
            int x = toX(lag, values.length, left + 8, pw - 16);
            int y = toY(values[lag], -1.0, 1.0, top, ph);
            g.drawLine(x, zero, x, y);
            g.fillOval(x - 3, y - 3, 6, 6);
        }
        g.setStroke(new BasicStroke(1f));
        g.setColor(AXIS_TEXT);
        g.setFont(new Font("SansSerif", Font.PLAIN, 12));
        g.drawString("lag 0", left, top + ph + 18);
        g.drawString("lag " + (values.length - 1), left + pw - 40, top + ph + 18);
    }

    private static Color divergingColor(double v) {
        if (!Double.isFinite(v)) {
            return Color.LIGHT_GRAY;
        }
        double t = Math.max(-1.0, Math.min(1.0, v));
        Color end = t >= 0 ? new Color(180, 4, 38) : new Color(59, 76, 192);
        double w = Math.abs(t);
        return new Color(
                (int) Math.round(221 + (end.getRed() - 221) * w),
                (int) Math.round(221 + (end.getGreen() - 221) * w),
                (int) Math.round(221 + (end.getBlue() - 221) * w));
    }

    private static double[] range(double[] values, double extraA, double extraB) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (!Double.isFinite(v)) continue;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        for (double v : new double[]{extraA, extraB}) {
            if (!Double.isFinite(v)) continue;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (!Double.isFinite(min) || !Double.isFinite(max)) return new double[]{0.0, 1.0};
        if (max <= min) return new double[]{min - 1.0, max + 1.0};
        double pad = (max - min) * 0.05;
        return new double[]{min - pad, max + pad};
    }

    private static int toX(int index, int size, int left, int width) {
        if (size <= 1) return left;
        return left + (int) Math.round(index * 1.0 / (size - 1) * width);
    }

    private static int scale(double value, double min, double max, int left, int width) {
        if (max <= min) return left + width / 2;
        return left + (int) Math.round((value - min) / (max - min) * width);
    }

    private static int toY(double value, double min, double max, int top, int height) {
        if (max <= min) return top + height / 2;
        double ratio = (value - min) / (max - min);
        return top + height - (int) Math.round(ratio * height);
    }

    private static String trim(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max - 1) + "~";
    }
}
