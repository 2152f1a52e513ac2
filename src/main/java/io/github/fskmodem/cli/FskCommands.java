/*
 * This file is licensed under the GNU General Public License v3.0.
 *
 * You may obtain a copy of the License at
 * https://www.gnu.org/licenses/gpl-3.0.html
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 * See the GNU General Public License for more details.
 */
package io.github.fskmodem.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import io.github.fskmodem.ConfigurationException;
import io.github.fskmodem.DecodeResult;
import io.github.fskmodem.DemodulationListener;
import io.github.fskmodem.DemodulatorConfig;
import io.github.fskmodem.FskDemodulator;
import io.github.fskmodem.FskModulator;
import io.github.fskmodem.InputFormatException;
import io.github.fskmodem.ModulationParameters;
import io.github.fskmodem.ToneEstimator;
import io.github.fskmodem.ToneEstimator.ToneEstimate;
import io.github.fskmodem.atoms.BitDecision;
import io.github.fskmodem.atoms.FrequencyAggregation;
import io.github.fskmodem.cli.CommandLineOptions.UsageException;
import io.github.fskmodem.dsp.SpectralPeak;
import io.github.fskmodem.io.BitFiles;
import io.github.fskmodem.io.CsvSamples;
import io.github.fskmodem.io.WavAudio;
import io.github.fskmodem.io.WavFiles;
import io.github.fskmodem.util.BitSequence;
import lombok.extern.slf4j.Slf4j;

/**
 * The sub-commands behind {@link FskTool}. Results go to {@code out}, diagnostics to the log.
 */
@Slf4j
public class FskCommands {

  public static final int EXIT_OK = 0;
  public static final int EXIT_USAGE = 1;
  public static final int EXIT_ERROR = 2;
  public static final int EXIT_INCOMPLETE = 3;

  static final String USAGE = String.join(System.lineSeparator(),
    "usage:",
    "  encode <bits> [--bits-file f] [--frequency Hz] [--deviation Hz] [--baud-rate b]",
    "         [--sample-rate Hz] [--amplitude a] [--output out.wav] [--csv out.csv] [--debug level]",
    "  decode <file.wav|file.csv> [--frequency Hz] [--deviation Hz] [--baud-rate b]",
    "         [--sample-rate Hz] [--column n] [--window n] [--hop n] [--fft n] [--margin Hz]",
    "         [--aggregation median|mean|weighted] [--no-filter] [--debug level]",
    "  estimate <file.wav> [--n count] [--min-spacing Hz] [--debug level]");

  private static final Set<String> COMMON = Set.of("frequency", "deviation", "baud-rate", "sample-rate", "debug");
  private static final Set<String> ENCODE_OPTIONS = union(COMMON, Set.of("bits-file", "amplitude", "output", "csv"));
  private static final Set<String> DECODE_OPTIONS = union(COMMON,
    Set.of("column", "window", "hop", "fft", "margin", "aggregation"));
  private static final Set<String> ESTIMATE_OPTIONS = Set.of("n", "min-spacing", "debug");

  private final PrintStream out;

  public FskCommands(PrintStream out) {
    this.out = out;
  }

  /**
   * Run one command.
   *
   * @return process exit code
   */
  public int run(String[] args) {
    try {
      if (args.length == 0) {
        throw new UsageException("missing command");
      }
      switch (args[0]) {
        case "encode":
          return encode(CommandLineOptions.parse(args, ENCODE_OPTIONS, Set.of()));
        case "decode":
          return decode(CommandLineOptions.parse(args, DECODE_OPTIONS, Set.of("no-filter")));
        case "estimate":
          return estimate(CommandLineOptions.parse(args, ESTIMATE_OPTIONS, Set.of()));
        default:
          throw new UsageException("unknown command '" + args[0] + "'");
      }
    } catch (UsageException e) {
      log.error("{}", e.getMessage());
      out.println(USAGE);
      return EXIT_USAGE;
    } catch (ConfigurationException e) {
      log.error("Invalid configuration: {}", e.getMessage());
      return EXIT_ERROR;
    } catch (InputFormatException e) {
      log.error("Invalid input: {}", e.getMessage());
      return EXIT_ERROR;
    } catch (IOException e) {
      log.error("I/O error: {}", e.getMessage(), e);
      return EXIT_ERROR;
    }
  }

  int encode(CommandLineOptions opts) throws IOException {
    BitSequence bits;
    if (opts.has("bits-file")) {
      bits = BitFiles.read(Paths.get(opts.getString("bits-file", null)));
    } else {
      bits = BitSequence.parse(single(opts, "bits"));
    }
    ModulationParameters params = parameters(opts,
      opts.getInt("sample-rate", ModulationParameters.DEFAULT_SAMPLE_RATE));
    FskModulator modulator = new FskModulator(params, (float) opts.getDouble("amplitude", 1.0));
    float[] signal = modulator.modulate(bits);

    log.info("Generated FSK signal for bits: {}", bits);
    log.info("Number of bits: {}", bits.size());
    log.info(String.format(Locale.ROOT, "Total duration: %.4f seconds", bits.size() * params.getBitDuration()));
    log.info("Number of samples: {}", signal.length);
    log.info("Baud rate used: {} baud", params.getBaudRate());
    log.info("Sample rate used: {} Hz", params.getSampleRate());
    log.info("Frequency used: {} Hz", params.getCenterFrequency());
    log.info("Deviation used: {} Hz", params.getDeviation());

    Path output = Paths.get(opts.getString("output", "output.wav"));
    WavFiles.write(output, signal, params.getSampleRate());
    log.info("FSK signal saved to {}", output);
    if (opts.has("csv")) {
      Path csv = Paths.get(opts.getString("csv", null));
      CsvSamples.write(csv, signal);
      log.info("Samples saved to {}", csv);
    }
    return EXIT_OK;
  }

  int decode(CommandLineOptions opts) throws IOException {
    Path input = Paths.get(single(opts, "input file"));
    FrequencyAggregation aggregation = aggregation(opts.getString("aggregation", "median"));
    int column = opts.getInt("column", 0);
    if (column < 0) {
      throw new UsageException("--column must not be negative, got " + column);
    }
    float[] samples;
    int sampleRate;
    if (input.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv")) {
      samples = CsvSamples.read(input, column);
      sampleRate = opts.getInt("sample-rate", ModulationParameters.DEFAULT_SAMPLE_RATE);
    } else {
      WavAudio audio = WavFiles.read(input);
      samples = audio.getSamples();
      sampleRate = audio.getSampleRate();
      if (opts.has("sample-rate") && opts.getInt("sample-rate", sampleRate) != sampleRate) {
        log.warn("Ignoring --sample-rate, {} declares {} Hz", input, sampleRate);
      }
    }
    ModulationParameters params = parameters(opts, sampleRate);
    DemodulatorConfig config = DemodulatorConfig.builder()
      .windowSize(opts.getInt("window", 0))
      .hopSize(opts.getInt("hop", 0))
      .fftSize(opts.getInt("fft", 0))
      .searchMargin(opts.getDouble("margin", 0.0))
      .aggregation(aggregation)
      .prefilter(!opts.hasFlag("no-filter"))
      .build();
    FskDemodulator demodulator = new FskDemodulator(params, config, traceListener());
    log.debug("Demodulating {} samples with {} (window {}, hop {}, fft {})", samples.length, params,
      demodulator.getWindowSize(), demodulator.getHopSize(), demodulator.getFftSize());

    DecodeResult result = demodulator.demodulate(samples);
    out.println(result.toPatternString());

    log.info("Decoded data: {}", result.toPatternString());
    log.info("Number of bits: {}", result.size());
    log.info(String.format(Locale.ROOT, "Total duration: %.4f seconds", (double) samples.length / sampleRate));
    log.info("Number of samples: {}", samples.length);
    log.info("Sample rate used: {} Hz", sampleRate);
    log.info("Frequency used: {} Hz", params.getCenterFrequency());
    log.info("Deviation used: {} Hz", params.getDeviation());
    if (!result.isComplete()) {
      log.warn("Decoding incomplete: no usable frames for bit position(s) {}", result.getMissingPositions());
      return EXIT_INCOMPLETE;
    }
    return EXIT_OK;
  }

  int estimate(CommandLineOptions opts) throws IOException {
    Path input = Paths.get(single(opts, "input file"));
    WavAudio audio = WavFiles.read(input);
    log.info(String.format(Locale.ROOT, "Detected sample rate: %.2f kHz", audio.getSampleRate() / 1000.0));
    double minSpacing = opts.getDouble("min-spacing", 0.0);
    List<SpectralPeak> peaks = ToneEstimator.dominantFrequencies(
      audio.getSamples(), audio.getSampleRate(), opts.getInt("n", 10), minSpacing);
    for (int i = 0; i < peaks.size(); i++) {
      log.info("Detected {} most frequent frequency: {}", i + 1, formatFrequency(peaks.get(i).getFrequency()));
      log.info("Magnitude of {} most frequent frequency: {}", i + 1, formatMagnitude(peaks.get(i).getMagnitude()));
    }
    Optional<ToneEstimate> estimate = ToneEstimator.estimate(audio.getSamples(), audio.getSampleRate(), minSpacing);
    if (estimate.isEmpty()) {
      log.error("FSK parameter estimation failed: fewer than two spectral peaks");
      return EXIT_ERROR;
    }
    ToneEstimate e = estimate.get();
    log.info(String.format(Locale.ROOT, "Estimated center frequency: %.2f Hz", e.getCenterFrequency()));
    log.info(String.format(Locale.ROOT, "Estimated frequency deviation: %.2f Hz", e.getDeviation()));
    log.info(String.format(Locale.ROOT, "Estimated deviation range: %.2f Hz - %.2f Hz",
      e.getSpaceFrequency(), e.getMarkFrequency()));
    out.println(String.format(Locale.ROOT, "center=%.2f deviation=%.2f", e.getCenterFrequency(), e.getDeviation()));
    return EXIT_OK;
  }

  private static ModulationParameters parameters(CommandLineOptions opts, int sampleRate) {
    return new ModulationParameters(
      opts.getDouble("frequency", ModulationParameters.DEFAULT_CENTER_FREQUENCY),
      opts.getDouble("deviation", ModulationParameters.DEFAULT_DEVIATION),
      opts.getDouble("baud-rate", ModulationParameters.DEFAULT_BAUD_RATE),
      sampleRate);
  }

  private static FrequencyAggregation aggregation(String name) {
    switch (name.toLowerCase(Locale.ROOT)) {
      case "median": return FrequencyAggregation.MEDIAN;
      case "mean": return FrequencyAggregation.MEAN;
      case "weighted": return FrequencyAggregation.MAGNITUDE_WEIGHTED;
      default: throw new UsageException("unknown aggregation '" + name + "'");
    }
  }

  private static DemodulationListener traceListener() {
    if (!log.isDebugEnabled()) {
      return DemodulationListener.NONE;
    }
    return new DemodulationListener() {
      @Override
      public void onBitDecision(BitDecision decision) {
        log.debug("{}", decision);
      }

      @Override
      public void onMissingBit(int bitIndex, int startSample) {
        log.debug("bit {} @{}: no usable frame", bitIndex, startSample);
      }
    };
  }

  private static String single(CommandLineOptions opts, String what) {
    if (opts.getPositional().size() != 1) {
      throw new UsageException("expected exactly one " + what + " argument, got " + opts.getPositional().size());
    }
    return opts.getPositional().get(0);
  }

  static String formatFrequency(double frequency) {
    if (frequency >= 1e6) {
      return String.format(Locale.ROOT, "%.2f MHz", frequency / 1e6);
    } else if (frequency >= 1e3) {
      return String.format(Locale.ROOT, "%.2f kHz", frequency / 1e3);
    }
    return String.format(Locale.ROOT, "%.2f Hz", frequency);
  }

  static String formatMagnitude(double magnitude) {
    if (magnitude >= 1e6) {
      return String.format(Locale.ROOT, "%.4f M", magnitude / 1e6);
    } else if (magnitude >= 1e3) {
      return String.format(Locale.ROOT, "%.4f K", magnitude / 1e3);
    }
    return String.format(Locale.ROOT, "%.4f", magnitude);
  }

  private static Set<String> union(Set<String> a, Set<String> b) {
    Set<String> all = new HashSet<>(a);
    all.addAll(b);
    return Set.copyOf(all);
  }
}
