package de.alive.mailwatch.infrastructure;

import de.alive.mailwatch.domain.ParsedEmail;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EmailContentExtractorTest {

    private final EmailContentExtractor extractor = new EmailContentExtractor();

    private static byte[] raw(String... lines) {
        return String.join("\r\n", lines).getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Encoded headers and quoted-printable bodies are decoded")
    void testDecoding() {
        ParsedEmail email = extractor.parse(raw(
                "From: =?UTF-8?Q?J=C3=BCrgen?= <juergen@example.com>",
                "To: me@example.com",
                "Date: Mon, 2 Oct 2023 10:00:00 +0200",
                "Subject: =?UTF-8?Q?Rechnung_f=C3=BCr_Sie?=",
                "MIME-Version: 1.0",
                "Content-Type: text/plain; charset=UTF-8",
                "Content-Transfer-Encoding: quoted-printable",
                "",
                "Viele Gr=C3=BC=C3=9Fe",
                ""));

        assertThat(email.sender()).isEqualTo("Jürgen <juergen@example.com>");
        assertThat(email.recipient()).isEqualTo("me@example.com");
        assertThat(email.date()).isEqualTo("Mon, 2 Oct 2023 10:00:00 +0200");
        assertThat(email.subject()).isEqualTo("Rechnung für Sie");
        assertThat(email.body()).isEqualTo("Viele Grüße");
    }

    @Test
    @DisplayName("Plain-text parts are joined, HTML and attachments are skipped")
    void testMultipart() {
        ParsedEmail email = extractor.parse(raw(
                "From: sender@example.com",
                "Subject: Report",
                "MIME-Version: 1.0",
                "Content-Type: multipart/mixed; boundary=\"outer\"",
                "",
                "--outer",
                "Content-Type: multipart/alternative; boundary=\"inner\"",
                "",
                "--inner",
                "Content-Type: text/plain; charset=UTF-8",
                "",
                "First part",
                "--inner",
                "Content-Type: text/html; charset=UTF-8",
                "",
                "<p>First part</p>",
                "--inner--",
                "--outer",
                "Content-Type: text/plain; charset=UTF-8",
                "",
                "Second part",
                "--outer",
                "Content-Type: text/plain; charset=UTF-8",
                "Content-Disposition: attachment; filename=\"notes.txt\"",
                "",
                "Attached notes",
                "--outer--",
                ""));

        assertThat(email.body()).contains("First part").contains("Second part");
        assertThat(email.body()).doesNotContain("<p>").doesNotContain("Attached notes");
    }

    @Test
    @DisplayName("Links are collected once each without trailing punctuation")
    void testUrls() {
        ParsedEmail email = extractor.parse(raw(
                "From: sender@example.com",
                "Subject: Verify",
                "Content-Type: text/plain; charset=UTF-8",
                "",
                "Log in at https://bank.example.test/login. Or (http://short.example/x).",
                "Again: https://bank.example.test/login",
                ""));

        assertThat(email.urls()).containsExactly("https://bank.example.test/login", "http://short.example/x");
    }

    @Test
    @DisplayName("Missing headers come back empty")
    void testMissingHeaders() {
        ParsedEmail email = extractor.parse(raw(
                "Content-Type: text/plain",
                "",
                "just a body",
                ""));

        assertThat(email.sender()).isEmpty();
        assertThat(email.subject()).isEmpty();
        assertThat(email.body()).isEqualTo("just a body");
        assertThat(email.urls()).isEmpty();
    }

    @Test
    @DisplayName("Formatted text lists headers, links and body")
    void testFormat() {
        ParsedEmail email = new ParsedEmail("a@example.com", "b@example.com", "today", "Hello",
                "Body text", List.of("https://x.example"));

        assertThat(extractor.format(email)).isEqualTo(
                "From: a@example.com\nTo: b@example.com\nDate: today\nSubject: Hello\n"
                        + "URLs: https://x.example\n\nBody:\nBody text");
    }

    @Test
    @DisplayName("Formatted text omits the link line when there are none")
    void testFormatWithoutUrls() {
        ParsedEmail email = new ParsedEmail("a@example.com", "", "", "Hello", "Body", List.of());

        assertThat(extractor.format(email)).doesNotContain("URLs:").endsWith("\n\nBody:\nBody");
    }
}
