/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.retrotrace;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.retrotrace.tree.ChangeNotifier;
import org.retrotrace.tree.ChangeTag;
import org.retrotrace.tree.SourcePosition;

/** A ChangeNotifier that saves each change for later inspection. */
public class RecordingNotifier implements ChangeNotifier {

  /** One recorded change. */
  public static class Change {
    public final ChangeTag tag;
    public final SourcePosition position;
    public final String message;

    Change(ChangeTag tag, SourcePosition position, String message) {
      this.tag = tag;
      this.position = position;
      this.message = message;
    }

    @Override
    public String toString() {
      return tag + " " + position + ": " + message;
    }
  }

  private final List<Change> changes = new ArrayList<>();

  @Override
  public void signalChange(ChangeTag tag, SourcePosition position, String message) {
    changes.add(new Change(tag, position, message));
  }

  public ImmutableList<Change> changes() {
    return ImmutableList.copyOf(changes);
  }

  public ImmutableList<String> messages() {
    return changes.stream().map(c -> c.message).collect(ImmutableList.toImmutableList());
  }

  public int count() {
    return changes.size();
  }

  public void clear() {
    changes.clear();
  }
}
