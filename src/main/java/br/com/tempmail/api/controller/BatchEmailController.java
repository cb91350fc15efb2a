package br.com.tempmail.api.controller;

import br.com.tempmail.api.dto.BatchDownload;
import br.com.tempmail.api.dto.BatchHistoryResponse;
import br.com.tempmail.api.dto.BatchTaskStatusDTO;
import br.com.tempmail.api.dto.CreateBatchRequest;
import br.com.tempmail.api.dto.CreateBatchResponse;
import br.com.tempmail.api.dto.ProgressSnapshot;
import br.com.tempmail.api.exception.InvalidArgumentException;
import br.com.tempmail.api.security.CurrentUser;
import br.com.tempmail.api.security.UserContext;
import br.com.tempmail.api.service.BatchCreationService;
import br.com.tempmail.api.service.BatchHistoryService;
import br.com.tempmail.api.service.ChunkProcessor;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/api/emails/batch")
public class BatchEmailController {

    private static final Logger logger = LoggerFactory.getLogger(BatchEmailController.class);

    private final BatchCreationService creationService;
    private final ChunkProcessor chunkProcessor;
    private final BatchHistoryService historyService;
    private final UserContext userContext;

    public BatchEmailController(BatchCreationService creationService,
                                ChunkProcessor chunkProcessor,
                                BatchHistoryService historyService,
                                UserContext userContext) {
        this.creationService = creationService;
        this.chunkProcessor = chunkProcessor;
        this.historyService = historyService;
        this.userContext = userContext;
    }

    /**
     * Cria a tarefa e devolve o "recibo" na hora; o processamento segue em segundo plano.
     */
    @PostMapping("/create")
    public ResponseEntity<CreateBatchResponse> create(@Valid @RequestBody CreateBatchRequest request) {
        CurrentUser user = userContext.requireCurrentUser();
        return ResponseEntity.ok(creationService.createBatch(user, request));
    }

    // Avança um lote. Chamado pelo worker interno e pelo polling do front.
    @PostMapping("/process")
    public ResponseEntity<ProgressSnapshot> process(@RequestParam(required = false) String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new InvalidArgumentException("O ID da tarefa não pode ser vazio");
        }
        logger.debug("Disparo de processamento para a tarefa {}", taskId);
        return ResponseEntity.ok(chunkProcessor.advance(taskId));
    }

    @GetMapping("/status/{taskId}")
    public ResponseEntity<BatchTaskStatusDTO> status(@PathVariable String taskId) {
        CurrentUser user = userContext.requireCurrentUser();
        return ResponseEntity.ok(historyService.getStatus(user, taskId));
    }

    @GetMapping("/download/{taskId}")
    public ResponseEntity<String> download(@PathVariable String taskId) {
        CurrentUser user = userContext.requireCurrentUser();
        BatchDownload download = historyService.downloadAddresses(user, taskId);

        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(download.filename())
                .build();

        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(download.content());
    }

    @GetMapping("/history")
    public ResponseEntity<BatchHistoryResponse> history(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset
    ) {
        CurrentUser user = userContext.requireCurrentUser();
        return ResponseEntity.ok(historyService.listHistory(user, limit, offset));
    }
}
