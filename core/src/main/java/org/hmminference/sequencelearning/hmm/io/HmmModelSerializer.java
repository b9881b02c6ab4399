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

import org.hmminference.sequencelearning.hmm.HmmModel;
import org.hmminference.sequencelearning.hmm.HmmModelValidator;
import org.hmminference.sequencelearning.hmm.HmmValidationException;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Reads and writes models in the binary {@link HmmModelWritable} form.
 */
public final class HmmModelSerializer {
  private HmmModelSerializer() {
  }

  public static void serialize(HmmModel model, DataOutput output) throws IOException {
    new HmmModelWritable(model).write(output);
  }

  public static HmmModel deserialize(DataInput input) throws IOException {
    return deserialize(input, new HmmModelValidator());
  }

  /**
   * @throws IOException if the stream is truncated or corrupt
   * @throws HmmValidationException if the stored parameters are not well-formed
   */
  public static HmmModel deserialize(DataInput input, HmmModelValidator validator) throws IOException {
    HmmModelWritable writable = new HmmModelWritable();
    writable.readFields(input);
    return writable.get(validator);
  }
}
