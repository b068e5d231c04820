package uk.gegc.aiready.features.conversion.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.aiready.features.conversion.domain.ExtractionException;
import uk.gegc.aiready.features.conversion.domain.SourceKind;
import uk.gegc.aiready.features.conversion.domain.model.PresentationContent;
import uk.gegc.aiready.features.conversion.domain.model.SlideData;
import uk.gegc.aiready.util.TestFiles;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PresentationContentExtractor Tests")
class PresentationContentExtractorTest {

    private PresentationContentExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new PresentationContentExtractor();
    }

    @Test
    void supports_acceptsPowerPointExtensionsAndMimeTypes() {
        assertThat(extractor.supports("deck.pptx")).isTrue();
        assertThat(extractor.supports("deck.ppt")).isTrue();
        assertThat(extractor.supports("application/vnd.ms-powerpoint")).isTrue();
        assertThat(extractor.supports("deck.key")).isFalse();
    }

    @Test
    @DisplayName("extract: pptx yields titles, body lines without the title, and tables")
    void extract_pptx_readsSlides() throws Exception {
        // When
        PresentationContent content = (PresentationContent) extractor.extract(TestFiles.pptx(), "deck.pptx");

        // Then
        assertThat(content.kind()).isEqualTo(SourceKind.POWERPOINT_PRESENTATION);
        assertThat(content.slides()).hasSize(2);

        SlideData first = content.slides().get(0);
        assertThat(first.number()).isEqualTo(1);
        assertThat(first.title()).isEqualTo("Roadmap");
        assertThat(first.content()).containsExactly("Ship the converter", "Collect feedback");
        assertThat(first.tables()).isEmpty();

        SlideData second = content.slides().get(1);
        assertThat(second.number()).isEqualTo(2);
        assertThat(second.hasTitle()).isFalse();
        assertThat(second.tables()).hasSize(1);
        assertThat(second.tables().get(0).headers()).containsExactly("Quarter", "Goal");
        assertThat(second.tables().get(0).rows()).containsExactly(List.of("Q1", "Beta"));
        assertThat(content.metadata()).containsEntry("slideCount", 2);
    }

    @Test
    @DisplayName("extract: speaker notes are read from the notes body")
    void extract_pptx_readsNotes() throws Exception {
        PresentationContent content = (PresentationContent) extractor.extract(TestFiles.pptx(), "deck.pptx");

        assertThat(content.slides().get(0).notes()).isEqualTo("Mention the deadline");
        assertThat(content.slides().get(1).hasNotes()).isFalse();
    }

    @Test
    @DisplayName("extract: non-PowerPoint bytes raise ExtractionException")
    void extract_garbage_throwsExtractionException() {
        byte[] garbage = "not a slide deck at all".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> extractor.extract(garbage, "deck.pptx"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Failed to read presentation");
    }
}
