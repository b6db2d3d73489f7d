package io.intellixity.unisql.exec;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/** Opaque id of a submitted warehouse statement. */
public final class StatementHandle {
  private final String id;
  private final AtomicBoolean fetched = new AtomicBoolean();

  public StatementHandle(String id) {
    this.id = Objects.requireNonNull(id, "id");
    if (id.isBlank()) throw new IllegalArgumentException("statement id is blank");
  }

  public String id() { return id; }

  /** Marks the handle as consumed; throws if a result was already retrieved through it. */
  public void claimFetch() {
    if (!fetched.compareAndSet(false, true)) {
      throw new IllegalStateException("Result already fetched for statement " + id);
    }
  }

  @Override
  public String toString() {
    return "StatementHandle[" + id + "]";
  }
}
