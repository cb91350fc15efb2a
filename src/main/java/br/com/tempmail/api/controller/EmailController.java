package br.com.tempmail.api.controller;

import br.com.tempmail.api.dto.GenerateEmailRequest;
import br.com.tempmail.api.dto.GenerateEmailResponse;
import br.com.tempmail.api.security.UserContext;
import br.com.tempmail.api.service.EmailGenerationService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/emails")
public class EmailController {

    private final EmailGenerationService generationService;
    private final UserContext userContext;

    public EmailController(EmailGenerationService generationService, UserContext userContext) {
        this.generationService = generationService;
        this.userContext = userContext;
    }

    // Criação síncrona (um endereço ou lote de até 50)
    @PostMapping("/generate")
    public ResponseEntity<GenerateEmailResponse> generate(@Valid @RequestBody GenerateEmailRequest request) {
        return ResponseEntity.ok(generationService.generate(userContext.requireCurrentUser(), request));
    }
}
