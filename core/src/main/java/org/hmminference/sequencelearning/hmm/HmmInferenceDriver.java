/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.hmminference.sequencelearning.hmm;

import com.google.common.base.Joiner;
import org.apache.commons.cli2.CommandLine;
import org.apache.commons.cli2.Group;
import org.apache.commons.cli2.Option;
import org.apache.commons.cli2.OptionException;
import org.apache.commons.cli2.builder.ArgumentBuilder;
import org.apache.commons.cli2.builder.DefaultOptionBuilder;
import org.apache.commons.cli2.builder.GroupBuilder;
import org.apache.commons.cli2.commandline.Parser;
import org.apache.commons.lang.NullArgumentException;
import org.hmminference.common.CommandLineUtil;
import org.hmminference.sequencelearning.hmm.io.HmmModelSerializer;
import org.hmminference.sequencelearning.hmm.io.HmmModelTextReader;
import org.hmminference.sequencelearning.hmm.io.ObservedSequenceReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.DataInputStream;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Command-line tool running the forward and/or Viterbi algorithm for every observed sequence of
 * an input file. Each input line produces one tab-separated output line: the likelihood, the
 * decoded hidden states, or both. A sequence which can not be processed produces
 * {@code error<TAB>message} and the remaining sequences are still processed.
 */
public class HmmInferenceDriver {
  public enum Algorithm {
    FORWARD, VITERBI, BOTH
  }

  static final String ERROR_PREFIX = "error";

  private static Logger log = LoggerFactory.getLogger(HmmInferenceDriver.class);

  private static final Joiner SPACE = Joiner.on(' ');
  private static final Joiner TAB = Joiner.on('\t');

  private final HiddenMarkovModel hmm;
  private final Algorithm algorithm;

  public HmmInferenceDriver(HiddenMarkovModel hmm, Algorithm algorithm) {
    if (hmm == null)
      throw new NullArgumentException("hmm");
    if (algorithm == null)
      throw new NullArgumentException("algorithm");
    this.hmm = hmm;
    this.algorithm = algorithm;
  }

  public static void main(String[] args) throws IOException {
    DefaultOptionBuilder optionBuilder = new DefaultOptionBuilder();
    ArgumentBuilder argumentBuilder = new ArgumentBuilder();

    Option modelOption = optionBuilder.withLongName("model").
      withDescription("Path to the HMM model").
      withShortName("m").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(true).create();

    Option inputOption = optionBuilder.withLongName("input").
      withDescription("Text file with one sequence of space-separated observed states per line").
      withShortName("i").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(true).create();

    Option outputOption = optionBuilder.withLongName("output").
      withDescription("Output file, standard output if omitted").
      withShortName("o").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("path").create()).withRequired(false).create();

    Option algorithmOption = optionBuilder.withLongName("algorithm").
      withDescription("forward, viterbi or both (default)").
      withShortName("a").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("name").withDefault("both").create()).withRequired(false).create();

    Option formatOption = optionBuilder.withLongName("format").
      withDescription("Model format: text (default) or binary").
      withShortName("f").withArgument(argumentBuilder.withMaximum(1).withMinimum(1).
      withName("name").withDefault("text").create()).withRequired(false).create();

    Group optionGroup = new GroupBuilder().withOption(modelOption).
      withOption(inputOption).withOption(outputOption).withOption(algorithmOption).
      withOption(formatOption).withName("Options").create();

    CommandLine commandLine;
    try {
      Parser parser = new Parser();
      parser.setGroup(optionGroup);
      commandLine = parser.parse(args);
    } catch (OptionException e) {
      CommandLineUtil.printHelp(optionGroup, e);
      return;
    }

    String modelPath = (String) commandLine.getValue(modelOption);
    String inputPath = (String) commandLine.getValue(inputOption);
    String outputPath = (String) commandLine.getValue(outputOption);
    String algorithmName = (String) commandLine.getValue(algorithmOption, "both");
    String formatName = (String) commandLine.getValue(formatOption, "text");

    Algorithm algorithm = parseAlgorithm(algorithmName);
    if (algorithm == null || !("text".equals(formatName) || "binary".equals(formatName))) {
      log.error("Unsupported algorithm '{}' or model format '{}'", algorithmName, formatName);
      CommandLineUtil.printHelp(optionGroup);
      return;
    }

    HmmModel model = loadModel(modelPath, "binary".equals(formatName));
    log.info("Loaded {} from {}", model, modelPath);

    List<List<String>> sequences;
    Reader input = new InputStreamReader(new FileInputStream(inputPath), StandardCharsets.UTF_8);
    try {
      sequences = ObservedSequenceReader.read(input);
    } finally {
      input.close();
    }

    Writer output = outputPath == null
      ? new OutputStreamWriter(System.out, StandardCharsets.UTF_8)
      : new OutputStreamWriter(new FileOutputStream(outputPath), StandardCharsets.UTF_8);
    try {
      int failures = new HmmInferenceDriver(new HiddenMarkovModel(model), algorithm).run(sequences, output);
      log.info("Processed {} sequences, {} failed", sequences.size(), failures);
    } finally {
      if (outputPath == null)
        output.flush();
      else
        output.close();
    }
  }

  static Algorithm parseAlgorithm(String name) {
    if (name == null)
      return Algorithm.BOTH;
    for (Algorithm algorithm : Algorithm.values()) {
      if (algorithm.name().equals(name.toUpperCase(Locale.ROOT)))
        return algorithm;
    }
    return null;
  }

  static HmmModel loadModel(String path, boolean binary) throws IOException {
    if (binary) {
      DataInputStream modelStream = new DataInputStream(new FileInputStream(path));
      try {
        return HmmModelSerializer.deserialize(modelStream);
      } finally {
        modelStream.close();
      }
    }
    Reader reader = new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8);
    try {
      return new HmmModelTextReader().read(reader);
    } finally {
      reader.close();
    }
  }

  /**
   * Writes one result line per sequence.
   * @return the number of sequences which could not be processed
   */
  public int run(List<List<String>> sequences, Writer output) throws IOException {
    PrintWriter writer = new PrintWriter(output);
    int failures = 0;
    int lineNumber = 0;
    for (List<String> sequence : sequences) {
      ++lineNumber;
      try {
        writer.println(process(sequence));
      } catch (HmmSequenceException e) {
        log.warn("Skipping sequence {}: {}", lineNumber, e.getMessage());
        writer.println(TAB.join(ERROR_PREFIX, e.getMessage()));
        ++failures;
      }
    }
    writer.flush();
    if (writer.checkError())
      throw new IOException("Failed to write results");
    return failures;
  }

  String process(List<String> sequence) {
    switch (algorithm) {
      case FORWARD:
        return Double.toString(hmm.forward(sequence));
      case VITERBI:
        return SPACE.join(hmm.viterbi(sequence));
      default:
        return TAB.join(hmm.forward(sequence), SPACE.join(hmm.viterbi(sequence)));
    }
  }
}
