/*
 * Copyright (c) 2025 The imcomplexity Development Team
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

package io.github.imcomplexity.taskcontrol;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Status handling shared by all tasks. Subclasses implement {@link #process()}.
 */
public abstract class AbstractTask implements Task {

  private static final Logger logger = Logger.getLogger(AbstractTask.class.getName());

  private volatile @NotNull TaskStatus status = TaskStatus.WAITING;
  private volatile @Nullable String errorMessage;

  @Override
  public final void run() {
    if (isCanceled()) {
      return;
    }
    setStatus(TaskStatus.PROCESSING);
    process();
  }

  protected abstract void process();

  @Override
  public @NotNull TaskStatus getStatus() {
    return status;
  }

  protected void setStatus(@NotNull TaskStatus newStatus) {
    this.status = newStatus;
  }

  @Override
  public @Nullable String getErrorMessage() {
    return errorMessage;
  }

  /**
   * Marks this task as failed.
   */
  protected void error(@NotNull String message, @Nullable Throwable cause) {
    logger.log(Level.WARNING, getTaskDescription() + ": " + message, cause);
    this.errorMessage = message;
    setStatus(TaskStatus.ERROR);
  }

  @Override
  public void cancel() {
    if (!isFinished()) {
      setStatus(TaskStatus.CANCELED);
    }
  }

  public boolean isCanceled() {
    return status == TaskStatus.CANCELED;
  }

  public boolean isFinished() {
    return status == TaskStatus.FINISHED || status == TaskStatus.ERROR
        || status == TaskStatus.CANCELED;
  }
}
