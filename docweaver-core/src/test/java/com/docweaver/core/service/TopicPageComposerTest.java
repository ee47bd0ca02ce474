package com.docweaver.core.service;

import com.docweaver.core.config.DocConvention;
import com.docweaver.core.context.DocContext;
import com.docweaver.core.model.ApiModel;
import com.docweaver.core.model.TopicModel;
import com.docweaver.core.renderer.GeneratedFile;
import com.docweaver.core.sitemap.SitemapNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TopicPageComposer}.
 */
class TopicPageComposerTest {

    @TempDir
    Path tempDir;

    private final TopicPageComposer composer = new TopicPageComposer(text -> "<html>" + text + "</html>");

    private DocContext context(DocConvention convention, URI baseUrl, TopicModel... topics) {
        return new DocContext(convention, baseUrl, ApiModel.empty(), List.of(topics), List.of());
    }

    @Test
    void compose_htmlConvention_transformsSource() throws IOException {
        // Given
        Path source = Files.writeString(tempDir.resolve("install.md"), "Install it.");
        TopicModel child = new TopicModel("guides/install", "Install", "https://docs.example.com/topics/guides/install.html",
            source, List.of());
        TopicModel parent = TopicModel.leaf("guides", "Guides", "https://docs.example.com/topics/guides.html");
        DocContext context = context(DocConvention.DOTNET, URI.create("https://docs.example.com/"),
            new TopicModel(parent.id(), parent.name(), parent.url(), null, List.of(child)));

        // When
        Optional<GeneratedFile> file = composer.compose(SitemapNode.page("Install", "topics/guides/install.html"), context);

        // Then
        assertThat(file).hasValueSatisfying(page -> {
            assertThat(page.relativePath()).isEqualTo("topics/guides/install.html");
            assertThat(page.content()).isEqualTo("<html>Install it.</html>");
            assertThat(page.contentType()).isEqualTo("text/html");
        });
    }

    @Test
    void compose_markdownConvention_copiesSource() throws IOException {
        Path source = Files.writeString(tempDir.resolve("intro.md"), "# Intro");
        DocContext context = context(DocConvention.DEVOPS, null,
            new TopicModel("intro", "Intro", "topics/intro.md", source, List.of()));

        Optional<GeneratedFile> file = composer.compose(SitemapNode.page("Intro", "topics/intro.md"), context);

        assertThat(file).hasValueSatisfying(page -> {
            assertThat(page.isCopy()).isTrue();
            assertThat(page.source()).isEqualTo(source);
        });
    }

    @Test
    void compose_encodedUrl_writesDecodedPath() throws IOException {
        Path source = Files.writeString(tempDir.resolve("Getting Started.md"), "Start here.");
        DocContext context = context(DocConvention.DOTNET, URI.create("https://docs.example.com/"),
            new TopicModel("Getting Started", "Getting Started", "topics/Getting%20Started.html", source, List.of()));

        Optional<GeneratedFile> file = composer.compose(
            SitemapNode.page("Getting Started", "topics/Getting%20Started.html"), context);

        assertThat(file).hasValueSatisfying(page ->
            assertThat(page.relativePath()).isEqualTo("topics/Getting Started.html"));
    }

    @Test
    void compose_newContext_usesItsOwnTopics() throws IOException {
        // Given
        Path first = Files.writeString(tempDir.resolve("first.md"), "First");
        Path second = Files.writeString(tempDir.resolve("second.md"), "Second");
        DocContext firstContext = context(DocConvention.DOTNET, null,
            new TopicModel("first", "First", "topics/first.html", first, List.of()));
        DocContext secondContext = context(DocConvention.DOTNET, null,
            new TopicModel("second", "Second", "topics/second.html", second, List.of()));

        // When
        composer.compose(SitemapNode.page("First", "topics/first.html"), firstContext);
        Optional<GeneratedFile> stale = composer.compose(SitemapNode.page("First", "topics/first.html"), secondContext);
        Optional<GeneratedFile> fresh = composer.compose(SitemapNode.page("Second", "topics/second.html"), secondContext);

        // Then
        assertThat(stale).isEmpty();
        assertThat(fresh).hasValueSatisfying(page -> assertThat(page.content()).isEqualTo("<html>Second</html>"));
    }

    @Test
    void compose_topicWithoutSource_returnsEmpty() {
        DocContext context = context(DocConvention.DOTNET, null, TopicModel.leaf("group", "Group", "topics/group.html"));

        assertThat(composer.compose(SitemapNode.page("Group", "topics/group.html"), context)).isEmpty();
    }

    @Test
    void compose_apiPage_returnsEmpty() {
        DocContext context = context(DocConvention.DOTNET, null);

        assertThat(composer.compose(SitemapNode.page("Widget", "api/Acme.Widget.html"), context)).isEmpty();
    }

    @Test
    void compose_unreadableSource_throwsException() {
        Path missing = tempDir.resolve("missing.md");
        DocContext context = context(DocConvention.DOTNET, null,
            new TopicModel("missing", "Missing", "topics/missing.html", missing, List.of()));

        assertThatThrownBy(() -> composer.compose(SitemapNode.page("Missing", "topics/missing.html"), context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to read topic file");
    }
}
