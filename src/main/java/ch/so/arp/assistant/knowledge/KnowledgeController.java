package ch.so.arp.assistant.knowledge;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST endpoint to upload, list and delete the knowledge documents of a
 * community.
 */
@RestController
@RequestMapping(path = "/api/communities/{community}/documents", produces = MediaType.APPLICATION_JSON_VALUE)
public class KnowledgeController {

    private static final Logger LOGGER = LoggerFactory.getLogger(KnowledgeController.class);

    private final KnowledgeIngestionService ingestionService;

    public KnowledgeController(KnowledgeIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<IngestionResult> upload(@PathVariable String community,
            @RequestParam("file") MultipartFile file, @RequestParam("uploadedBy") long uploadedBy) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read upload " + file.getOriginalFilename(), ex);
        }
        LOGGER.info("Ingesting '{}' ({} bytes) for community {}", file.getOriginalFilename(), content.length,
                community);
        IngestionResult result = ingestionService.ingest(community, file.getOriginalFilename(), content, uploadedBy);
        return ResponseEntity.status(result.isEmpty() ? HttpStatus.OK : HttpStatus.CREATED).body(result);
    }

    @GetMapping
    public List<KnowledgeDocument> list(@PathVariable String community) {
        return ingestionService.listDocuments(community);
    }

    @DeleteMapping("/{documentId}")
    public ResponseEntity<Void> delete(@PathVariable String community, @PathVariable long documentId) {
        if (!ingestionService.deleteDocument(community, documentId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
