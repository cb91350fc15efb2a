package br.com.tempmail.api.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@ControllerAdvice // Intercepta exceções de todos os controllers
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // Nossas exceções de domínio: o status vem do @ResponseStatus de cada classe
    @ExceptionHandler({
            UnauthorizedException.class,
            ForbiddenException.class,
            ResourceNotFoundException.class,
            InvalidArgumentException.class,
            QuotaExceededException.class,
            AddressConflictException.class,
            GenerationExhaustedException.class,
            StorageFailureException.class
    })
    public ResponseEntity<Object> handleCustomExceptions(RuntimeException ex, WebRequest request) {
        HttpStatus status = resolveStatus(ex);

        if (status.is4xxClientError()) {
            logger.warn("Erro {} tratado: {}", status, ex.getMessage()); // Loga como aviso
        } else {
            logger.error("Erro {} tratado:", status, ex);
        }

        return buildErrorResponse(ex.getMessage(), status, request);
    }

    // Parâmetro ausente, corpo malformado ou inválido -> 400
    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentNotValidException.class
    })
    public ResponseEntity<Object> handleBadRequest(Exception ex, WebRequest request) {
        logger.warn("Requisição inválida: {}", ex.getMessage());
        String message = ex instanceof MethodArgumentNotValidException invalid && invalid.getBindingResult().hasFieldErrors()
                ? invalid.getBindingResult().getFieldErrors().get(0).getField() + ": "
                    + invalid.getBindingResult().getFieldErrors().get(0).getDefaultMessage()
                : "Requisição inválida";
        return buildErrorResponse(message, HttpStatus.BAD_REQUEST, request);
    }

    // Manipula QUALQUER outra exceção não tratada (retorna 500)
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleAllUncaughtException(Exception ex, WebRequest request) {
        logger.error("Erro inesperado:", ex); // Stack trace só no log, não vai para o cliente

        return buildErrorResponse("Erro interno do servidor", HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    private HttpStatus resolveStatus(RuntimeException ex) {
        ResponseStatus annotation = ex.getClass().getAnnotation(ResponseStatus.class);
        return annotation != null ? annotation.value() : HttpStatus.INTERNAL_SERVER_ERROR;
    }

    // Método auxiliar para construir a resposta JSON padronizada
    private ResponseEntity<Object> buildErrorResponse(String message, HttpStatus status, WebRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", LocalDateTime.now());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        body.put("path", request.getDescription(false).replace("uri=", "")); // Caminho da URL

        return new ResponseEntity<>(body, status);
    }
}
