/*
 * Copyright IBM Corp. 2025
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.terracotta.crest.assertion;

/**
 * Entry points for fluent assertions.
 * <pre>{@code
 *   import static org.terracotta.crest.assertion.Assertions.assertThat;
 *   import static org.terracotta.crest.matchers.Matchers.*;
 *
 *   assertThat(result).isEqualTo(Arrays.asList(1, 2, 3));
 *   assertThat("total", total).matches(between(0, 100));
 *   assertThat(() -> parse("")).raisesError(IllegalArgumentException.class, includes("empty"));
 * }</pre>
 */
public final class Assertions {

  private Assertions() {
    //no instances please
  }

  public static Asserter assertThat(Object actual) {
    return Asserter.forValue(null, actual);
  }

  /**
   * Starts an assertion on {@code actual} whose failure messages are prefixed by {@code reason}.
   *
   * @param reason the failure message prefix
   * @param actual the value under test
   * @return an {@code Asserter} bound to {@code actual}
   */
  public static Asserter assertThat(String reason, Object actual) {
    return Asserter.forValue(reason, actual);
  }

  /**
   * Starts an assertion on the outcome of {@code block}.  The block is run by the
   * {@code raises} operations of the returned {@code Asserter}, not by this method.
   * <p>
   * A {@code null} block is taken to be the value {@code null}.
   *
   * @param block the computation under test
   * @return an {@code Asserter} bound to {@code block}
   */
  public static Asserter assertThat(Block block) {
    return assertThat(null, block);
  }

  public static Asserter assertThat(String reason, Block block) {
    return block == null ? Asserter.forValue(reason, null) : Asserter.forBlock(reason, block);
  }
}
