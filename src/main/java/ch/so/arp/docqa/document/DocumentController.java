package ch.so.arp.docqa.document;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import ch.so.arp.docqa.exception.ValidationException;
import jakarta.validation.Valid;

/**
 * REST endpoints for uploading, listing, summarizing and deleting documents.
 */
@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private final DocumentService documentService;
    private final DocumentSummarizer documentSummarizer;

    public DocumentController(DocumentService documentService, DocumentSummarizer documentSummarizer) {
        this.documentService = Objects.requireNonNull(documentService, "documentService must not be null");
        this.documentSummarizer = Objects.requireNonNull(documentSummarizer, "documentSummarizer must not be null");
    }

    @PostMapping(consumes = "multipart/form-data")
    public ResponseEntity<IngestResult> upload(@RequestParam("file") MultipartFile file) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException ex) {
            throw new ValidationException("Could not read uploaded file: " + ex.getMessage());
        }
        IngestResult result = documentService.ingestFile(content, file.getOriginalFilename());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PostMapping("/text")
    public ResponseEntity<IngestResult> ingestText(@Valid @RequestBody IngestTextRequest request) {
        IngestResult result = documentService.ingest(request.content(), request.filename(), request.metadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping
    public List<DocumentOverview> list() {
        return documentService.listDocuments();
    }

    @GetMapping("/{filename}/summary")
    public DocumentSummary summary(@PathVariable String filename) {
        return documentSummarizer.summarize(filename);
    }

    @DeleteMapping("/{filename}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String filename) {
        boolean deleted = documentService.delete(filename);
        if (!deleted) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("filename", filename, "deleted", false));
        }
        return ResponseEntity.ok(Map.of("filename", filename, "deleted", true));
    }

    @DeleteMapping
    public Map<String, Object> deleteAll() {
        return Map.of("deletedChunks", documentService.deleteAll());
    }
}
