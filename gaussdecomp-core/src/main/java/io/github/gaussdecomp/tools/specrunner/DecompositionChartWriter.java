/*
 * Copyright (c) 2004-2025 The gaussdecomp Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.gaussdecomp.tools.specrunner;

import com.google.common.collect.Range;
import io.github.gaussdecomp.datamodel.GaussianParameters;
import io.github.gaussdecomp.datamodel.Spectrum;
import io.github.gaussdecomp.datamodel.decomposition.FitOutcome;
import java.awt.BasicStroke;
import java.awt.Color;
import java.io.File;
import java.io.IOException;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.DatasetRenderingOrder;
import org.jfree.chart.plot.IntervalMarker;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.title.TextTitle;
import org.jfree.chart.ui.Layer;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Saves a PNG chart of a spectrum with its decomposition: data, individual components, the summed
 * model and the summed initial guess. Signal ranges are drawn as background markers.
 */
public class DecompositionChartWriter {

  private static final Color DATA = new Color(90, 90, 90);
  private static final Color MODEL = new Color(200, 0, 0);
  private static final Color GUESS = new Color(0, 0, 200, 160);
  private static final Color COMPONENT = new Color(0, 150, 0, 170);

  private final int width;
  private final int height;

  public DecompositionChartWriter() {
    this(1200, 600);
  }

  public DecompositionChartWriter(int width, int height) {
    this.width = width;
    this.height = height;
  }

  public void saveChart(@NotNull File out, @NotNull String title, @NotNull Spectrum spectrum,
      @NotNull FitOutcome outcome) throws IOException {
    final XYSeriesCollection ds = new XYSeriesCollection();
    ds.addSeries(series("Data", spectrum.velocity(), spectrum.intensity()));

    final GaussianParameters guess = outcome.initialGuess();
    final GaussianParameters fit = outcome.bestFit();
    if (!guess.isEmpty()) {
      ds.addSeries(
          series("Initial guess", spectrum.velocity(), guess.evaluate(spectrum.velocity())));
    }
    if (fit != null && !fit.isEmpty()) {
      ds.addSeries(series("Model", spectrum.velocity(), fit.evaluate(spectrum.velocity())));
      for (int i = 0; i < fit.componentCount(); i++) {
        final GaussianParameters single = GaussianParameters.ofComponents(
            List.of(fit.component(i)));
        ds.addSeries(series("Component " + (i + 1), spectrum.velocity(),
            single.evaluate(spectrum.velocity())));
      }
    }

    final JFreeChart chart = ChartFactory.createXYLineChart(title, "Velocity", "Intensity", ds,
        PlotOrientation.VERTICAL, true, false, false);
    final XYPlot plot = chart.getXYPlot();
    plot.setDatasetRenderingOrder(DatasetRenderingOrder.FORWARD);

    final XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, false);
    for (int s = 0; s < ds.getSeriesCount(); s++) {
      final String key = ds.getSeriesKey(s).toString();
      if (key.equals("Data")) {
        renderer.setSeriesPaint(s, DATA);
        renderer.setSeriesStroke(s, new BasicStroke(1f));
      } else if (key.equals("Model")) {
        renderer.setSeriesPaint(s, MODEL);
        renderer.setSeriesStroke(s, new BasicStroke(2f));
      } else if (key.equals("Initial guess")) {
        renderer.setSeriesPaint(s, GUESS);
        renderer.setSeriesStroke(s, new BasicStroke(1.5f, BasicStroke.CAP_BUTT,
            BasicStroke.JOIN_MITER, 10f, new float[]{6f, 4f}, 0f));
      } else {
        renderer.setSeriesPaint(s, COMPONENT);
        renderer.setSeriesStroke(s, new BasicStroke(1f));
        renderer.setSeriesVisibleInLegend(s, s == firstComponentSeries(ds));
      }
    }
    plot.setRenderer(renderer);

    for (Range<Integer> r : spectrum.signalRanges()) {
      if (!r.hasLowerBound() || !r.hasUpperBound()) {
        continue;
      }
      final double lower = spectrum.velocity()[Math.max(0, r.lowerEndpoint())];
      final double upper = spectrum.velocity()[Math.min(spectrum.size() - 1,
          r.upperEndpoint() - 1)];
      final IntervalMarker m = new IntervalMarker(Math.min(lower, upper), Math.max(lower, upper));
      m.setPaint(new Color(0, 128, 0, 30));
      plot.addDomainMarker(m, Layer.BACKGROUND);
    }

    chart.addSubtitle(new TextTitle("Components: %d initial, %d final".formatted(
        guess.componentCount(), outcome.componentCount())));
    ChartUtils.saveChartAsPNG(out, chart, width, height);
  }

  private static int firstComponentSeries(XYSeriesCollection ds) {
    for (int s = 0; s < ds.getSeriesCount(); s++) {
      if (ds.getSeriesKey(s).toString().startsWith("Component")) {
        return s;
      }
    }
    return -1;
  }

  private static XYSeries series(String key, double[] x, double[] y) {
    final XYSeries series = new XYSeries(key, false, true);
    for (int i = 0; i < x.length; i++) {
      series.add(x[i], y[i]);
    }
    return series;
  }
}
