package br.com.tempmail.api.config;

import br.com.tempmail.api.model.enums.Role;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Configuração do serviço de e-mails temporários (prefixo {@code tempmail}).
 */
@ConfigurationProperties(prefix = "tempmail")
@NoArgsConstructor
@Getter
@Setter
public class TempMailProperties {

    /** Domínios aceitos na criação de endereços. */
    private List<String> domains = new ArrayList<>(List.of("moemail.app"));

    /** Tempos de expiração aceitos, em milissegundos. 0 = nunca expira. */
    private List<Long> expiryOptions = new ArrayList<>(List.of(
            3_600_000L,     // 1 hora
            86_400_000L,    // 24 horas
            259_200_000L,   // 3 dias
            0L));

    private Quota quota = new Quota();

    private Batch batch = new Batch();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Quota {

        /** Limite padrão de e-mails ativos por usuário. */
        private int maxActiveEmails = 30;

        /** Limites específicos por role; EMPEROR é sempre isento. */
        private Map<Role, Integer> roleLimits = new EnumMap<>(Role.class);

        public int maxActiveFor(Role role) {
            return roleLimits.getOrDefault(role, maxActiveEmails);
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Batch {

        /** Acima deste número a criação vai para o modo assíncrono. */
        private int asyncThreshold = 50;

        /** Endereços gerados por chamada de processamento. */
        private int chunkSize = 100;

        /** Linhas por INSERT (limite de parâmetros do banco). */
        private int insertBatchSize = 20;

        /** Retenção da tarefa no armazenamento efêmero, renovada a cada escrita. */
        private Duration taskTtl = Duration.ofHours(24);

        private int historyDefaultLimit = 20;

        private int historyMaxLimit = 100;

        private int queueCapacity = 10_000;

        private Worker worker = new Worker();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Worker {

        private boolean enabled = true;

        private int threads = 4;
    }
}
