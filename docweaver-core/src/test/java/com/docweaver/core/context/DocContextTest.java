package com.docweaver.core.context;

import com.docweaver.core.config.DocConvention;
import com.docweaver.core.model.ApiModel;
import com.docweaver.core.model.TopicModel;
import com.docweaver.core.sitemap.Sitemap;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DocContext}.
 */
class DocContextTest {

    @Test
    void getBaseUrl_appendsTrailingSlash() {
        DocContext context = new DocContext(DocConvention.DOTNET, URI.create("https://docs.example.com/v2"),
            null, null, null);

        assertThat(context.getBaseUrl()).hasToString("https://docs.example.com/v2/");
        assertThat(context.getApiModel().isEmpty()).isTrue();
        assertThat(context.getTopics()).isEmpty();
        assertThat(context.getAssets()).isEmpty();
    }

    @Test
    void getBaseUrl_withoutBaseUrl_isSiteRoot() {
        DocContext context = new DocContext(DocConvention.DOTNET, null, ApiModel.empty(), List.of(), List.of());

        assertThat(context.getBaseUrl()).hasToString("/");
    }

    @Test
    void getSitemap_buildsOnceAndReusesIt() {
        DocContext context = new DocContext(DocConvention.DOCFX, null, ApiModel.empty(),
            List.of(TopicModel.leaf("intro", "Intro", "topics/intro.html#top")), List.of());

        Sitemap first = context.getSitemap();

        assertThat(context.getSitemap()).isSameAs(first);
        assertThat(first.getPageCount()).isEqualTo(1);
        assertThat(first.getNodes().get(0).getItems().get(0).getUrl()).isEqualTo("topics/intro.html");
    }
}
