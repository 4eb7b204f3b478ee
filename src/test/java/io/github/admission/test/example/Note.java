package io.github.admission.test.example;

import java.util.UUID;

/** Minimal aggregate exercising the CQRS building blocks. */
public final class Note {
  private final UUID id;
  private String content;

  public Note(final UUID id, final String content) {
    this.id = id;
    this.content = content;
  }

  public UUID getId() {
    return id;
  }

  public String getContent() {
    return content;
  }

  public void rename(final String newContent) {
    if (newContent == null || newContent.isBlank()) {
      throw new IllegalArgumentException("Note content cannot be blank");
    }

    this.content = newContent;
  }
}
