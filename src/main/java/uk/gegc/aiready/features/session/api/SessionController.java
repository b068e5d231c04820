package uk.gegc.aiready.features.session.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.aiready.features.conversion.application.MimeTypeDetector;
import uk.gegc.aiready.features.session.api.dto.ClearResponse;
import uk.gegc.aiready.features.session.api.dto.ConversionResultView;
import uk.gegc.aiready.features.session.api.dto.ConvertResponse;
import uk.gegc.aiready.features.session.api.dto.FileView;
import uk.gegc.aiready.features.session.api.dto.PreviewResponse;
import uk.gegc.aiready.features.session.api.dto.SessionView;
import uk.gegc.aiready.features.session.application.ArchiveAssembler;
import uk.gegc.aiready.features.session.application.BatchConversionService;
import uk.gegc.aiready.features.session.application.FileLifecycleService;
import uk.gegc.aiready.features.session.application.SessionStore;
import uk.gegc.aiready.features.session.config.SessionProperties;
import uk.gegc.aiready.features.session.domain.model.ConversionResult;
import uk.gegc.aiready.features.session.domain.model.DownloadedFile;
import uk.gegc.aiready.features.session.domain.model.SessionSnapshot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for session-scoped file conversion.
 * The session is identified by the {@value #SESSION_COOKIE} cookie; only the session and upload endpoints
 * start a new session when the cookie is missing or stale.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Conversion", description = "Upload files, convert them to Markdown or JSON and download the results")
public class SessionController {

    static final String SESSION_COOKIE = "session_id";

    private final SessionStore sessionStore;
    private final FileLifecycleService fileLifecycleService;
    private final BatchConversionService batchConversionService;
    private final ArchiveAssembler archiveAssembler;
    private final MimeTypeDetector mimeTypeDetector;
    private final SessionProperties sessionProperties;

    @Operation(
            summary = "Get or create session",
            description = "Resumes the session named by the cookie, or starts a new one, and lists its files"
    )
    @ApiResponse(
            responseCode = "200",
            description = "Session state",
            content = @Content(schema = @Schema(implementation = SessionView.class))
    )
    @GetMapping("/session")
    public ResponseEntity<SessionView> getSession(
            @Parameter(hidden = true) @CookieValue(name = SESSION_COOKIE, required = false) String sessionId) {
        SessionSnapshot session = sessionStore.getOrCreate(sessionId);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookie(session.id()).toString())
                .body(toView(session));
    }

    @Operation(summary = "Delete session", description = "Discards the session and every file in it")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Session deleted"),
            @ApiResponse(responseCode = "404", description = "Session not found or expired")
    })
    @DeleteMapping("/session")
    public ResponseEntity<Void> deleteSession(
            @Parameter(hidden = true) @CookieValue(name = SESSION_COOKIE, required = false) String sessionId) {
        sessionStore.delete(sessionId);
        ResponseCookie expired = ResponseCookie.from(SESSION_COOKIE, "")
                .httpOnly(true)
                .sameSite("Strict")
                .path("/")
                .maxAge(0)
                .build();
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, expired.toString())
                .build();
    }

    @Operation(
            summary = "Upload file",
            description = "Adds a PDF, Word, Excel/CSV, PowerPoint or image file to the session"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "201",
                    description = "File accepted",
                    content = @Content(schema = @Schema(implementation = FileView.class))
            ),
            @ApiResponse(responseCode = "400", description = "File is empty or missing"),
            @ApiResponse(responseCode = "413", description = "File or session size limit exceeded"),
            @ApiResponse(responseCode = "415", description = "Unsupported file type")
    })
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<FileView> upload(
            @Parameter(hidden = true) @CookieValue(name = SESSION_COOKIE, required = false) String sessionId,
            @Parameter(description = "File to upload", required = true) @RequestParam("file") MultipartFile file) throws IOException {

        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File is required");
        }

        SessionSnapshot session = sessionStore.getOrCreate(sessionId);
        log.info("Upload of '{}' ({} bytes) to session {}", file.getOriginalFilename(), file.getSize(), session.id());
        FileView view = FileView.from(fileLifecycleService.upload(session.id(), file.getOriginalFilename(), file.getBytes()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .header(HttpHeaders.SET_COOKIE, sessionCookie(session.id()).toString())
                .body(view);
    }

    @Operation(summary = "Set output format", description = "Changes the output format of a file that has not been converted yet")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Format updated"),
            @ApiResponse(responseCode = "404", description = "Session or file not found"),
            @ApiResponse(responseCode = "409", description = "File already converted"),
            @ApiResponse(responseCode = "415", description = "Unknown format")
    })
    @PostMapping("/files/{fileId}/format")
    public FileView setFormat(
            @Parameter(hidden = true) @CookieValue(name = SESSION_COOKIE, required = false) String sessionId,
            @PathVariable UUID fileId,
            @Parameter(description = "markdown, md or json", required = true) @RequestParam("format") String format) {
        return FileView.from(fileLifecycleService.setFormat(sessionId, fileId, format));
    }

    @Operation(summary = "Delete file", description = "Removes a file and frees its share of the session quota")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "File deleted"),
            @ApiResponse(responseCode = "404", description = "Session or file not found")
    })
    @DeleteMapping("/files/{fileId}")
    public ResponseEntity<Void> deleteFile(
            @Parameter(hidden = true) @CookieValue(name = SESSION_COOKIE, required = false) String sessionId,
            @PathVariable UUID fileId) {
        fileLifecycleService.deleteFile(sessionId, fileId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Clear session", description = "Removes every file; the session stays")
    @DeleteMapping("/clear")
    public ClearResponse clear(
            @Parameter(hidden = true) @CookieValue(name = SESSION_COOKIE, required = false) String sessionId) {
        return new ClearResponse(fileLifecycleService.clear(sessionId));
    }

    @Operation(summary = "Convert files", description = "Converts every uploaded file; failures are reported per file")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Batch finished",
                    content = @Content(schema = @Schema(implementation = ConvertResponse.class))
            ),
            @ApiResponse(responseCode = "404", description = "Session not found or expired")
    })
    @PostMapping("/convert")
    public ConvertResponse convert(
            @Parameter(hidden = true) @CookieValue(name = SESSION_COOKIE, required = false) String sessionId) {
        List<ConversionResult> results = batchConversionService.convertAll(sessionId);
        long converted = results.stream().filter(ConversionResult::succeeded).count();
        return new ConvertResponse(
                results.stream().map(ConversionResultView::from).toList(),
                converted,
                results.size() - converted
        );
    }

    @Operation(summary = "Preview converted file", description = "Returns the beginning of the converted output")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Preview"),
            @ApiResponse(responseCode = "404", description = "Session or file not found"),
            @ApiResponse(responseCode = "409", description = "File not converted")
    })
    @GetMapping("/files/{fileId}/preview")
    public PreviewResponse preview(
            @Parameter(hidden = true) @CookieValue(name = SESSION_COOKIE, required = false) String sessionId,
            @PathVariable UUID fileId) {
        return PreviewResponse.from(fileLifecycleService.getPreview(sessionId, fileId));
    }

    @Operation(summary = "Download converted file")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Markdown or JSON file"),
            @ApiResponse(responseCode = "404", description = "Session or file not found"),
            @ApiResponse(responseCode = "409", description = "File not converted")
    })
    @GetMapping("/files/{fileId}/download")
    public ResponseEntity<byte[]> download(
            @Parameter(hidden = true) @CookieValue(name = SESSION_COOKIE, required = false) String sessionId,
            @PathVariable UUID fileId) {
        DownloadedFile file = fileLifecycleService.download(sessionId, fileId);
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.parseMediaType(file.mediaType()), StandardCharsets.UTF_8))
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(file.filename()))
                .body(file.content());
    }

    @Operation(summary = "Download all converted files", description = "ZIP archive of every converted file")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "ZIP archive"),
            @ApiResponse(responseCode = "400", description = "No converted files"),
            @ApiResponse(responseCode = "404", description = "Session not found or expired")
    })
    @GetMapping("/download-all")
    public ResponseEntity<byte[]> downloadAll(
            @Parameter(hidden = true) @CookieValue(name = SESSION_COOKIE, required = false) String sessionId) {
        byte[] archive = archiveAssembler.buildArchive(sessionId);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("application/zip"))
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(ArchiveAssembler.ARCHIVE_FILENAME))
                .body(archive);
    }

    private SessionView toView(SessionSnapshot session) {
        return new SessionView(
                session.id(),
                session.files().stream().map(FileView::from).toList(),
                session.totalBytes(),
                List.copyOf(mimeTypeDetector.supportedExtensions()),
                sessionProperties.getMaxFileSize().toBytes(),
                sessionProperties.getMaxSessionSize().toBytes(),
                sessionProperties.getTtl().toSeconds()
        );
    }

    private ResponseCookie sessionCookie(String sessionId) {
        return ResponseCookie.from(SESSION_COOKIE, sessionId)
                .httpOnly(true)
                .sameSite("Strict")
                .path("/")
                .maxAge(sessionProperties.getTtl())
                .build();
    }

    private static String attachment(String filename) {
        return ContentDisposition.attachment()
                .filename(filename, StandardCharsets.UTF_8)
                .build()
                .toString();
    }
}
