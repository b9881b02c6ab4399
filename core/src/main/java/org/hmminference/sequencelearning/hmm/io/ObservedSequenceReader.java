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

package org.hmminference.sequencelearning.hmm.io;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads observed sequences, one per line, as whitespace-separated labels.
 * Blank lines are skipped.
 */
public final class ObservedSequenceReader {
  private static final Splitter LABELS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private ObservedSequenceReader() {
  }

  public static List<List<String>> read(Reader reader) throws IOException {
    List<List<String>> sequences = new ArrayList<List<String>>();
    BufferedReader lines = new BufferedReader(reader);
    String line;
    while ((line = lines.readLine()) != null) {
      List<String> labels = LABELS.splitToList(line);
      if (!labels.isEmpty())
        sequences.add(labels);
    }
    return sequences;
  }
}
