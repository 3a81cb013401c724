package io.github.themoah.edgepulse.detection;

import io.github.themoah.edgepulse.model.AnomalyCandidate;
import io.github.themoah.edgepulse.model.AnomalyRegion;
import io.github.themoah.edgepulse.model.AnomalyType;
import io.github.themoah.edgepulse.model.DetectedAnomaly;
import io.github.themoah.edgepulse.model.TrafficCategory;
import io.github.themoah.edgepulse.model.TrafficSeries;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects significant steps (spikes and dips) in CDN traffic.
 *
 * <p>Each category is compared against its own baseline, the median of the valid
 * (margin-trimmed) range. Deviations are expressed as ratios to the baseline and a bucket
 * is anomalous when its ratio is more than one standard deviation of all ratios away
 * from zero, so the threshold follows each category's natural volatility.
 *
 * <p>Regions are scored as {@code peakDeviation * sqrt(duration) * weight}. The weights
 * encode operational priority:
 * <pre>
 *   red spike (5xx up)       2
 *   yellow spike (4xx up)    2
 *   green dip (traffic loss) 2
 *   green spike              2
 *   yellow dip               1
 *   red dip                  1
 * </pre>
 *
 * <p>Detection is pure and never throws for a well-formed series: short series,
 * zero variance and no qualifying regions all produce an empty result.
 */
public class StepDetector {

  private static final Logger log = LoggerFactory.getLogger(StepDetector.class);

  /** Minimum number of buckets required for detection. */
  public static final int MIN_SERIES_LENGTH = 8;

  private static final double EPSILON = 1e-10;

  private static final List<TrafficCategory> STATUS_CATEGORIES =
    List.of(TrafficCategory.RED, TrafficCategory.YELLOW, TrafficCategory.GREEN);

  // Legacy model: error score = 4xx * 2 + 5xx * 5
  private static final int LEGACY_CLIENT_WEIGHT = 2;
  private static final int LEGACY_SERVER_WEIGHT = 5;

  private final DetectionConfig config;

  public StepDetector() {
    this(DetectionConfig.defaults());
  }

  public StepDetector(DetectionConfig config) {
    this.config = config;
  }

  public List<DetectedAnomaly> detectSteps(TrafficSeries series) {
    return detectSteps(series, config.maxCount(), config.options());
  }

  public List<DetectedAnomaly> detectSteps(TrafficSeries series, int maxCount) {
    return detectSteps(series, maxCount, config.options());
  }

  /**
   * Detects up to {@code maxCount} non-overlapping anomalies across the red, yellow and
   * green categories present in the series.
   *
   * @param series the traffic series
   * @param maxCount maximum anomalies to return
   * @param options margins and minimum gap
   * @return anomalies ranked 1..N by descending score, empty if none
   */
  public List<DetectedAnomaly> detectSteps(TrafficSeries series, int maxCount, DetectionOptions options) {
    int len = series.length();
    if (len < MIN_SERIES_LENGTH || maxCount <= 0) {
      return List.of();
    }
    int from = options.startMargin();
    int to = len - options.endMargin();
    if (to <= from) {
      log.debug("Margins {}+{} leave no valid range in {} buckets",
        options.startMargin(), options.endMargin(), len);
      return List.of();
    }

    List<AnomalyCandidate> candidates = new ArrayList<>();
    for (TrafficCategory category : STATUS_CATEGORIES) {
      if (!series.has(category)) {
        continue;
      }
      double[] values = series.valuesFor(category);
      collectCandidates(candidates, values, category, AnomalyType.SPIKE, options);
      collectCandidates(candidates, values, category, AnomalyType.DIP, options);
    }

    if (candidates.isEmpty()) {
      return List.of();
    }

    candidates.sort(Comparator.comparingDouble(AnomalyCandidate::score).reversed());
    List<AnomalyCandidate> selected = selectNonOverlapping(candidates, maxCount, options.minGap());

    List<DetectedAnomaly> anomalies = new ArrayList<>(selected.size());
    for (int i = 0; i < selected.size(); i++) {
      anomalies.add(DetectedAnomaly.of(selected.get(i), i + 1));
    }

    log.debug("Selected {} of {} candidates across {} buckets", anomalies.size(), candidates.size(), len);
    return anomalies;
  }

  public DetectedAnomaly detectStep(TrafficSeries series) {
    return detectStep(series, config.options());
  }

  /**
   * Detects the single most significant anomaly with the legacy two-category model.
   *
   * <p>Errors are combined into one weighted score ({@code 4xx * 2 + 5xx * 5}) and success
   * is the 2xx/3xx count. Error spikes and success dips weigh 10, success spikes 1;
   * error dips are never reported. An absent category counts as zero.
   *
   * @param series the traffic series
   * @param options margins (the gap is unused, there is only one winner)
   * @return the winning anomaly with rank 1, or null if nothing qualifies
   */
  public DetectedAnomaly detectStep(TrafficSeries series, DetectionOptions options) {
    int len = series.length();
    if (len < MIN_SERIES_LENGTH || len - options.endMargin() <= options.startMargin()) {
      return null;
    }

    double[] ok = series.valuesFor(TrafficCategory.GREEN);
    double[] client = series.valuesFor(TrafficCategory.YELLOW);
    double[] server = series.valuesFor(TrafficCategory.RED);
    double[] errors = new double[len];
    for (int i = 0; i < len; i++) {
      errors[i] = client[i] * LEGACY_CLIENT_WEIGHT + server[i] * LEGACY_SERVER_WEIGHT;
    }

    List<AnomalyCandidate> candidates = new ArrayList<>();
    collectCandidates(candidates, errors, TrafficCategory.ERROR, AnomalyType.SPIKE, options);
    collectCandidates(candidates, ok, TrafficCategory.SUCCESS, AnomalyType.DIP, options);
    collectCandidates(candidates, ok, TrafficCategory.SUCCESS, AnomalyType.SPIKE, options);

    AnomalyCandidate winner = null;
    for (AnomalyCandidate candidate : candidates) {
      if (winner == null || candidate.score() > winner.score()) {
        winner = candidate;
      }
    }

    if (winner == null) {
      return null;
    }
    log.debug("Legacy winner: {} {} at {}..{} (score={})", winner.category().getValue(),
      winner.type().getValue(), winner.start(), winner.end(), String.format("%.2f", winner.score()));
    return DetectedAnomaly.of(winner, 1);
  }

  /**
   * Returns the importance weight of a category/direction signal.
   *
   * @return the weight, or 0 for signals that are never reported
   */
  static double weight(TrafficCategory category, AnomalyType type) {
    boolean spike = type == AnomalyType.SPIKE;
    return switch (category) {
      case RED, YELLOW -> spike ? 2.0 : 1.0;
      case GREEN -> 2.0;
      case ERROR -> spike ? 10.0 : 0.0;
      case SUCCESS -> spike ? 1.0 : 10.0;
      default -> 0.0;
    };
  }

  private void collectCandidates(
      List<AnomalyCandidate> candidates,
      double[] values,
      TrafficCategory category,
      AnomalyType type,
      DetectionOptions options) {

    double weight = weight(category, type);
    if (weight <= 0) {
      return;
    }

    int from = options.startMargin();
    int to = values.length - options.endMargin();
    double baseline = StatisticalUtils.median(values, from, to);
    double[] deviations = StatisticalUtils.deviationRatios(values, baseline);
    double threshold = StatisticalUtils.stdDev(deviations, from, to);

    if (threshold < EPSILON) {
      return;  // No variance, nothing can cross the threshold
    }

    Direction direction = type == AnomalyType.SPIKE ? Direction.ABOVE : Direction.BELOW;
    List<AnomalyRegion> regions = RegionFinder.findRegions(
      deviations, threshold, direction, options.startMargin(), options.endMargin());

    for (AnomalyRegion region : regions) {
      double score = region.peakDeviation() * Math.sqrt(region.duration()) * weight;
      candidates.add(new AnomalyCandidate(region, category, type, score));
      log.trace("Candidate {} {} at {}..{}: peak={}, threshold={}, score={}",
        category.getValue(), type.getValue(), region.start(), region.end(),
        String.format("%.3f", region.peakDeviation()), String.format("%.3f", threshold),
        String.format("%.2f", score));
    }
  }

  /**
   * Greedily keeps candidates, best first, that stay clear of every region already kept.
   * The exclusion zone between two regions grows with both of their widths.
   */
  static List<AnomalyCandidate> selectNonOverlapping(
      List<AnomalyCandidate> sortedCandidates, int maxCount, int minGap) {

    List<AnomalyCandidate> selected = new ArrayList<>();
    for (AnomalyCandidate candidate : sortedCandidates) {
      if (selected.size() >= maxCount) {
        break;
      }
      boolean tooClose = selected.stream().anyMatch(s -> overlaps(candidate, s, minGap));
      if (!tooClose) {
        selected.add(candidate);
      }
    }
    return selected;
  }

  static int exclusionZone(AnomalyCandidate a, AnomalyCandidate b, int minGap) {
    int halfA = a.region().duration() / 2;
    int halfB = b.region().duration() / 2;
    return Math.max(minGap, halfA + halfB);
  }

  private static boolean overlaps(AnomalyCandidate candidate, AnomalyCandidate selected, int minGap) {
    int zone = exclusionZone(candidate, selected, minGap);
    return !(candidate.end() < selected.start() - zone || candidate.start() > selected.end() + zone);
  }
}
