package br.com.tempmail.api.service;

import br.com.tempmail.api.config.TempMailProperties;
import br.com.tempmail.api.exception.QuotaExceededException;
import br.com.tempmail.api.security.CurrentUser;
import br.com.tempmail.api.store.AddressStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

@Service
public class QuotaService {

    private static final Logger logger = LoggerFactory.getLogger(QuotaService.class);

    private final AddressStore addressStore;
    private final TempMailProperties.Quota quota;

    public QuotaService(AddressStore addressStore, TempMailProperties properties) {
        this.addressStore = addressStore;
        this.quota = properties.getQuota();
    }

    /**
     * Confere se o usuário pode ter mais {@code requested} e-mails ativos.
     * EMPEROR não tem limite.
     */
    public void ensureWithinQuota(CurrentUser user, int requested) {
        if (user.role().isQuotaExempt()) {
            return;
        }

        long current = addressStore.countActive(user.id(), LocalDateTime.now());
        int max = quota.maxActiveFor(user.role());

        if (current + requested > max) {
            logger.info("Cota excedida para {} ({}): {}/{} + {}", user.id(), user.role(), current, max, requested);
            throw new QuotaExceededException(current, max, requested);
        }
    }
}
