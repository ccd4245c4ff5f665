package it.aw.lawcorpus.config;

import it.aw.lawcorpus.model.CorpusBuildReport;
import it.aw.lawcorpus.service.CorpusAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Costruisce il corpus una volta all'avvio quando {@code corpus.build-on-startup=true}.
 * Un errore della build fa fallire l'avvio dell'applicazione.
 */
@Component
@ConditionalOnProperty(name = "corpus.build-on-startup", havingValue = "true")
public class CorpusBuildRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CorpusBuildRunner.class);

    private final CorpusAssembler assembler;

    public CorpusBuildRunner(CorpusAssembler assembler) {
        this.assembler = assembler;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Avvio: build del corpus richiesta da configurazione");
        CorpusBuildReport report = assembler.build();
        log.info("Avvio: corpus pronto in {} ({} voci)", report.outputFile(), report.entryCount());
    }
}
