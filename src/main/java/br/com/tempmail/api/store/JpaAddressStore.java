package br.com.tempmail.api.store;

import br.com.tempmail.api.model.EmailAddress;
import br.com.tempmail.api.repository.EmailAddressRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

@Component
public class JpaAddressStore implements AddressStore {

    private final EmailAddressRepository repository;

    public JpaAddressStore(EmailAddressRepository repository) {
        this.repository = repository;
    }

    @Override
    public boolean exists(String address) {
        return repository.existsByAddressKey(EmailAddress.normalize(address));
    }

    // Transação própria por sub-lote: uma colisão desfaz só este lote
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<EmailAddress> insertAll(List<EmailAddress> addresses) {
        return repository.saveAllAndFlush(addresses);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public EmailAddress insert(EmailAddress address) {
        return repository.saveAndFlush(address);
    }

    @Override
    public long countActive(String userId, LocalDateTime now) {
        return repository.countByUserIdAndExpiresAtAfter(userId, now);
    }

    @Override
    public List<String> findCreatedInWindow(String userId, String domain, LocalDateTime from, LocalDateTime to, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String suffix = "%@" + domain.toLowerCase(Locale.ROOT);
        return repository.findAddressesCreatedInWindow(userId, from, to, suffix, PageRequest.of(0, limit));
    }
}
