package com.demanddna.engine;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.IntStream;

/**
 * One row per calendar day of a projection year, column-oriented. Row {@code i} is day-of-year
 * {@code i + 1}. Each of the three layers holds a column per {@link IndexKind}.
 * Owned by a single pipeline run; the compiler mutates the layers in place while building it.
 */
public final class YearFrame {

    private final int year;
    private final LocalDate[] dates;
    private final int[] months;
    private final int[] weeks;
    private final int[] daysOfYear;
    private final Map<Layer, Map<IndexKind, double[]>> layers = new EnumMap<>(Layer.class);

    YearFrame(int year, LocalDate[] dates) {
        this.year = year;
        this.dates = dates;
        this.months = new int[dates.length];
        this.weeks = new int[dates.length];
        this.daysOfYear = new int[dates.length];
        for (int row = 0; row < dates.length; row++) {
            months[row] = Granularity.MONTHLY.periodOf(dates[row]);
            weeks[row] = Granularity.WEEKLY.periodOf(dates[row]);
            daysOfYear[row] = Granularity.DAILY.periodOf(dates[row]);
        }
        for (Layer layer : Layer.values()) {
            Map<IndexKind, double[]> columns = new EnumMap<>(IndexKind.class);
            for (IndexKind kind : IndexKind.values()) {
                columns.put(kind, new double[dates.length]);
            }
            layers.put(layer, columns);
        }
    }

    public int year() {
        return year;
    }

    public int size() {
        return dates.length;
    }

    public LocalDate date(int row) {
        return dates[row];
    }

    public int month(int row) {
        return months[row];
    }

    public int week(int row) {
        return weeks[row];
    }

    public int dayOfYear(int row) {
        return daysOfYear[row];
    }

    public int period(Granularity granularity, int row) {
        return switch (granularity) {
            case MONTHLY -> months[row];
            case WEEKLY -> weeks[row];
            case DAILY -> daysOfYear[row];
        };
    }

    public double index(Layer layer, IndexKind kind, int row) {
        return layers.get(layer).get(kind)[row];
    }

    public IndexValues indices(Layer layer, int row) {
        return new IndexValues(
            index(layer, IndexKind.TRAFFIC, row),
            index(layer, IndexKind.CONVERSION_RATE, row),
            index(layer, IndexKind.ORDER_VALUE, row));
    }

    double[] column(Layer layer, IndexKind kind) {
        return layers.get(layer).get(kind);
    }

    void copyLayer(Layer from, Layer to) {
        for (IndexKind kind : IndexKind.values()) {
            double[] source = column(from, kind);
            System.arraycopy(source, 0, column(to, kind), 0, source.length);
        }
    }

    /**
     * Row of the given date, or -1 when the date lies outside this year.
     */
    public int rowOf(LocalDate date) {
        return date.getYear() == year ? date.getDayOfYear() - 1 : -1;
    }

    public boolean overlaps(LocalDate start, LocalDate end) {
        return rowsBetween(start, end).length > 0;
    }

    /**
     * Rows whose date falls in the inclusive range, clipped to this year.
     */
    public int[] rowsBetween(LocalDate start, LocalDate end) {
        if (start == null || end == null || start.isAfter(end)
                || end.getYear() < year || start.getYear() > year) {
            return new int[0];
        }
        int from = start.getYear() < year ? 0 : start.getDayOfYear() - 1;
        int to = end.getYear() > year ? dates.length - 1 : end.getDayOfYear() - 1;
        int[] rows = new int[to - from + 1];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = from + i;
        }
        return rows;
    }

    public int[] rowsInPeriod(Granularity granularity, int period) {
        return IntStream.range(0, dates.length)
            .filter(row -> period(granularity, row) == period)
            .toArray();
    }

    /**
     * Mean index per period for every layer, ordered by period key.
     */
    public List<DnaProfilePoint> profile(Granularity granularity) {
        Map<Integer, List<Integer>> rowsByPeriod = new TreeMap<>();
        for (int row = 0; row < dates.length; row++) {
            rowsByPeriod.computeIfAbsent(period(granularity, row), k -> new ArrayList<>()).add(row);
        }
        List<DnaProfilePoint> points = new ArrayList<>();
        rowsByPeriod.forEach((period, rowList) -> {
            int[] rows = rowList.stream().mapToInt(Integer::intValue).toArray();
            points.add(new DnaProfilePoint(period, dates[rows[0]],
                meanIndices(Layer.PURE, rows), meanIndices(Layer.PRE_TRIAL, rows), meanIndices(Layer.WORK, rows)));
        });
        return points;
    }

    private IndexValues meanIndices(Layer layer, int[] rows) {
        return new IndexValues(
            Stats.mean(column(layer, IndexKind.TRAFFIC), rows),
            Stats.mean(column(layer, IndexKind.CONVERSION_RATE), rows),
            Stats.mean(column(layer, IndexKind.ORDER_VALUE), rows));
    }
}
