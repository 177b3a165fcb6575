package com.example.mailmerge.service;

import com.example.mailmerge.exception.ValidationException;
import com.example.mailmerge.model.MailTemplate;
import com.example.mailmerge.model.RecipientRecord;
import com.example.mailmerge.model.RenderedTemplate;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer();

    private static RecipientRecord alice() {
        return RecipientRecord.builder()
                .email("a@x.com")
                .firstname("Alice")
                .company("Acme")
                .field("email", "a@x.com")
                .field("firstname", "Alice")
                .field("company", "Acme")
                .field("cc", "")
                .build();
    }

    @Test
    void givenCompleteFields_whenRendering_thenAllPlaceholdersAreReplaced() {
        MailTemplate template = MailTemplate.builder()
                .subjectTemplate("Hi {firstname}")
                .htmlTemplate("<p>Dear {firstname} at {company}, reply to {email}</p>")
                .textTemplate("Dear {firstname}")
                .build();

        RenderedTemplate rendered = renderer.render(template, alice());

        assertThat(rendered.getSubject()).isEqualTo("Hi Alice");
        assertThat(rendered.getHtmlBody()).isEqualTo("<p>Dear Alice at Acme, reply to a@x.com</p>");
        assertThat(rendered.getTextBody()).isEqualTo("Dear Alice");
        assertThat(rendered.getHtmlBody()).doesNotContainPattern("\\{[A-Za-z_][A-Za-z0-9_]*}");
    }

    @Test
    void givenUnknownPlaceholder_whenRendering_thenValidationExceptionNamesIt() {
        MailTemplate template = MailTemplate.builder()
                .subjectTemplate("Hi {firstname}")
                .htmlTemplate("<p>{missing_field}</p>")
                .build();

        assertThatThrownBy(() -> renderer.render(template, alice()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("{missing_field}");
    }

    @Test
    void givenPlaceholderCase_whenRendering_thenMatchIsCaseSensitive() {
        assertThatThrownBy(() -> renderer.render("Hi {FirstName}", alice().getFields()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("FirstName");
    }

    @Test
    void givenEmptyFieldValue_whenRendering_thenPlaceholderBecomesEmpty() {
        assertThat(renderer.render("cc:[{cc}]", alice().getFields())).isEqualTo("cc:[]");
    }

    @Test
    void givenCssBraces_whenRendering_thenTheyAreLeftAlone() {
        String html = "<style>p {color: red;} .a{display:none}</style><p>{firstname}</p>";

        assertThat(renderer.render(html, alice().getFields()))
                .isEqualTo("<style>p {color: red;} .a{display:none}</style><p>Alice</p>");
    }

    @Test
    void givenValueWithReplacementCharacters_whenRendering_thenValueIsInsertedLiterally() {
        String rendered = renderer.render("Total {amount}", Map.of("amount", "$5 \\ {firstname}"));

        assertThat(rendered).isEqualTo("Total $5 \\ {firstname}");
    }

    @Test
    void givenNoTextTemplate_whenRendering_thenTextBodyIsNull() {
        MailTemplate template = MailTemplate.builder().subjectTemplate("s").htmlTemplate("h").build();

        assertThat(renderer.render(template, alice()).getTextBody()).isNull();
    }
}
