package net.cadence.core.model;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class JobTest {

    @Test
    void status_codes_are_read_case_insensitively() {
        assertThat(Job.Status.from(" paused ")).isEqualTo(Job.Status.PAUSED);
        assertThat(Job.Status.from("nope")).isEqualTo(Job.Status.UNKNOWN);
        assertThat(Job.Status.from(null)).isEqualTo(Job.Status.UNKNOWN);
    }

    @Test
    void status_parsing_ignores_default_locale() {
        Locale prev = Locale.getDefault();
        try {
            // 터키어 로케일에서 "i".toUpperCase() 는 점 있는 İ
            Locale.setDefault(new Locale("tr", "TR"));
            assertThat(Job.Status.from("active")).isEqualTo(Job.Status.ACTIVE);
            assertThat(Job.Status.from("failed")).isEqualTo(Job.Status.FAILED);
        } finally {
            Locale.setDefault(prev);
        }
    }
}
