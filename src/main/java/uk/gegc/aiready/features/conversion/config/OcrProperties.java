package uk.gegc.aiready.features.conversion.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.ocr")
public class OcrProperties {

    /**
     * Directory holding the Tesseract {@code tessdata} language files. When blank, Tess4J falls back to
     * the {@code TESSDATA_PREFIX} environment variable.
     */
    private String datapath;

    /**
     * Tesseract language code(s), e.g. {@code eng} or {@code eng+deu}.
     */
    @NotBlank
    private String language = "eng";
}
