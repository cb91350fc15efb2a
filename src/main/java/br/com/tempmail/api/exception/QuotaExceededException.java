package br.com.tempmail.api.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.FORBIDDEN)
@Getter
public class QuotaExceededException extends RuntimeException {

    private final long currentCount;
    private final long maxCount;
    private final int attemptedCount;

    public QuotaExceededException(long currentCount, long maxCount, int attemptedCount) {
        super("A criação excederia o limite de e-mails ativos. Atual: "
                + currentCount + "/" + maxCount + ", tentando criar: " + attemptedCount);
        this.currentCount = currentCount;
        this.maxCount = maxCount;
        this.attemptedCount = attemptedCount;
    }
}
