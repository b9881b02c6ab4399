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

import org.apache.hadoop.io.ArrayWritable;
import org.apache.hadoop.io.Text;
import org.apache.hadoop.io.Writable;
import org.apache.hadoop.io.WritableUtils;

import java.io.DataInput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Ordered state labels. {@link ArrayWritable} of {@link Text}
 */
class StateLabelsWritable extends ArrayWritable {
  static final int MAX_LABEL_BYTES = 1 << 16;

  public StateLabelsWritable() {
    super(Text.class);
  }

  public StateLabelsWritable(List<String> labels) {
    super(Text.class);
    Writable[] values = new Writable[labels.size()];
    int i = 0;
    for (String label : labels)
      values[i++] = new Text(label);
    set(values);
  }

  /**
   * Same layout as {@link ArrayWritable#readFields(DataInput)}, but a corrupt label count or label
   * length is reported as an {@link IOException}.
   */
  @Override
  public void readFields(DataInput input) throws IOException {
    int count = HmmModelWritable.readCount(input, "state labels");
    List<Writable> labels = new ArrayList<Writable>();
    for (int i = 0; i < count; ++i) {
      int length = WritableUtils.readVInt(input);
      if (length < 0 || length > MAX_LABEL_BYTES)
        throw new IOException("Corrupt state label " + i + ", length " + length);
      Text label = new Text();
      label.readWithKnownLength(input, length);
      labels.add(label);
    }
    set(labels.toArray(new Writable[labels.size()]));
  }

  public List<String> toLabels() {
    return Arrays.asList(toStrings());
  }
}
