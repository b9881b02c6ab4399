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
import org.apache.hadoop.io.DoubleWritable;
import org.apache.hadoop.io.Writable;

import java.io.DataInput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * The initial probabilities or one row of the transition or emission matrix,
 * stored as an {@link ArrayWritable} of {@link DoubleWritable}.
 * Values are not checked here, {@link HmmModelWritable#get} validates the whole model.
 */
class ProbabilitiesWritable extends ArrayWritable {
  public ProbabilitiesWritable() {
    super(DoubleWritable.class);
  }

  public ProbabilitiesWritable(double[] row) {
    this();
    Writable[] cells = new Writable[row.length];
    for (int i = 0; i < row.length; ++i)
      cells[i] = new DoubleWritable(row[i]);
    set(cells);
  }

  @Override
  public void readFields(DataInput input) throws IOException {
    int count = HmmModelWritable.readCount(input, "probabilities");
    // grown while reading, a corrupt count ends in EOFException rather than a huge allocation
    List<Writable> cells = new ArrayList<Writable>();
    for (int i = 0; i < count; ++i) {
      DoubleWritable cell = new DoubleWritable();
      cell.readFields(input);
      cells.add(cell);
    }
    set(cells.toArray(new Writable[cells.size()]));
  }

  public double[] toRow() {
    Writable[] cells = get();
    double[] row = new double[cells.length];
    for (int i = 0; i < cells.length; ++i)
      row[i] = ((DoubleWritable) cells[i]).get();
    return row;
  }
}
