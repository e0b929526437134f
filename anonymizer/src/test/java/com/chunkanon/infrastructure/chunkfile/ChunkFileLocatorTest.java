package com.chunkanon.infrastructure.chunkfile;

import com.chunkanon.application.anonymize.ChunkFileNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkFileLocatorTest {

    @TempDir
    Path dir;

    private ChunkFileLocator locator() {
        return new ChunkFileLocator(dir.toString());
    }

    private Path touch(String name) throws IOException {
        return Files.writeString(dir.resolve(name), "");
    }

    @Test
    @DisplayName("explicit path is used when it exists")
    void explicit_path() throws IOException {
        Path file = touch("custom.jsonl");

        assertThat(locator().locate(file.toString(), "ignored")).isEqualTo(file);
    }

    @Test
    @DisplayName("missing explicit path is fatal")
    void explicit_path_missing() {
        assertThatThrownBy(() -> locator().locate(dir.resolve("nope.jsonl").toString(), null))
                .isInstanceOf(ChunkFileNotFoundException.class)
                .hasMessageContaining("nope.jsonl");
    }

    @Test
    @DisplayName("without a filter the last X_1 file in name order is picked")
    void auto_detect_latest() throws IOException {
        touch("X_1_a_chunks.jsonl");
        Path latest = touch("X_1_b_chunks.jsonl");
        touch("X_2_z_anon.jsonl");
        touch("notes.txt");

        assertThat(locator().locate(null, null)).isEqualTo(latest);
        assertThat(locator().locate("  ", "")).isEqualTo(latest);
    }

    @Test
    @DisplayName("type filter is a case-insensitive substring; first match wins")
    void auto_detect_with_filter() throws IOException {
        Path whatsapp = touch("X_1_whatsapp_chunks.jsonl");
        touch("X_1_whatsapp_groups_chunks.jsonl");
        touch("X_1_gmail_chunks.jsonl");

        assertThat(locator().locate(null, "WHATS")).isEqualTo(whatsapp);
    }

    @Test
    @DisplayName("no match or no directory is fatal")
    void auto_detect_nothing() throws IOException {
        touch("X_1_gmail_chunks.jsonl");

        assertThatThrownBy(() -> locator().locate(null, "telegram"))
                .isInstanceOf(ChunkFileNotFoundException.class);
        assertThatThrownBy(() -> new ChunkFileLocator(dir.resolve("missing").toString()).locate(null, null))
                .isInstanceOf(ChunkFileNotFoundException.class);
    }
}
