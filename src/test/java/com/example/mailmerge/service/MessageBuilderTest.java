package com.example.mailmerge.service;

import com.example.mailmerge.exception.AttachmentException;
import com.example.mailmerge.exception.ValidationException;
import com.example.mailmerge.helper.MimeTypeHelper;
import com.example.mailmerge.model.AttachmentPayload;
import com.example.mailmerge.model.MergeRequest;
import com.example.mailmerge.model.RecipientRecord;
import com.example.mailmerge.model.RenderedMessage;
import com.example.mailmerge.model.RenderedTemplate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static com.example.mailmerge.util.TestData.writeFile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class MessageBuilderTest {

    @TempDir
    Path dir;

    private final MessageBuilder builder = new MessageBuilder(new MimeTypeHelper());
    private final RenderedTemplate rendered = new RenderedTemplate("Hi Alice", "<p>Hello</p>", null);

    private static MergeRequest request() {
        return MergeRequest.builder().build();
    }

    @Test
    void givenCcAndBccLists_whenBuilding_thenAddressesAreSplitAndTrimmed() {
        RecipientRecord recipient = RecipientRecord.builder()
                .email("a@x.com")
                .cc(" c1@x.com, c2@x.com ")
                .bcc("")
                .build();

        RenderedMessage message = builder.build(recipient, rendered, request());

        assertThat(message.getTo()).containsExactly("a@x.com");
        assertThat(message.getCc()).containsExactly("c1@x.com", "c2@x.com");
        assertThat(message.getBcc()).isEmpty();
        assertThat(message.getSubject()).isEqualTo("Hi Alice");
        assertThat(message.getHtmlBody()).isEqualTo("<p>Hello</p>");
        assertThat(message.getFrom()).isNull();
        assertThat(message.hasAttachments()).isFalse();
    }

    @Test
    void givenAttachments_whenBuilding_thenFilesAreLoadedInOrderWithMimeTypes() {
        Path pdf = writeFile(dir, "offer.pdf", "%PDF-1.4");
        Path unknown = writeFile(dir, "data.xyz", "raw");
        RecipientRecord recipient = RecipientRecord.builder()
                .email("a@x.com")
                .attachment(pdf.toString())
                .attachment(unknown.toString())
                .build();

        RenderedMessage message = builder.build(recipient, rendered, request());

        assertThat(message.getAttachmentPayloads())
                .extracting(AttachmentPayload::getFilename, AttachmentPayload::getMimeType)
                .containsExactly(
                        tuple("offer.pdf", "application/pdf"),
                        tuple("data.xyz", MimeTypeHelper.DEFAULT_TYPE));
        assertThat(new String(message.getAttachmentPayloads().get(0).getContent(), StandardCharsets.UTF_8))
                .isEqualTo("%PDF-1.4");
    }

    @Test
    void givenCommonAttachments_whenBuilding_thenTheyPrecedeRowAttachments() {
        Path common = writeFile(dir, "terms.txt", "terms");
        Path own = writeFile(dir, "own.txt", "own");
        RecipientRecord recipient = RecipientRecord.builder().email("a@x.com").attachment(own.toString()).build();
        MergeRequest request = MergeRequest.builder().commonAttachment(common.toString()).build();

        RenderedMessage message = builder.build(recipient, rendered, request);

        assertThat(message.getAttachmentPayloads()).extracting(AttachmentPayload::getFilename)
                .containsExactly("terms.txt", "own.txt");
    }

    @Test
    void givenMissingAttachment_whenBuilding_thenAttachmentExceptionCarriesThePath() {
        RecipientRecord recipient = RecipientRecord.builder().email("b@y.com").attachment("/missing.pdf").build();

        assertThatThrownBy(() -> builder.build(recipient, rendered, request()))
                .isInstanceOfSatisfying(AttachmentException.class, e -> {
                    assertThat(e.getPath()).isEqualTo("/missing.pdf");
                    assertThat(e.getMessage()).isEqualTo("attachment not found: /missing.pdf");
                });
    }

    @Test
    void givenDirectoryAsAttachment_whenBuilding_thenAttachmentExceptionIsThrown() {
        RecipientRecord recipient = RecipientRecord.builder().email("a@x.com").attachment(dir.toString()).build();

        assertThatThrownBy(() -> builder.build(recipient, rendered, request()))
                .isInstanceOf(AttachmentException.class)
                .hasMessageContaining("not a regular file");
    }

    @Test
    void givenInvalidCcAddress_whenBuilding_thenValidationExceptionIsThrown() {
        RecipientRecord recipient = RecipientRecord.builder().email("a@x.com").cc("not an address@@").build();

        assertThatThrownBy(() -> builder.build(recipient, rendered, request()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not an address@@");
    }

    @Test
    void givenExplicitSender_whenBuilding_thenFromIsSet() {
        RecipientRecord recipient = RecipientRecord.builder().email("a@x.com").build();
        MergeRequest request = MergeRequest.builder().sender("Team <team@x.com>").build();

        assertThat(builder.build(recipient, rendered, request).getFrom()).isEqualTo("Team <team@x.com>");
    }
}
