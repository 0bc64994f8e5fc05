package dev.haddaf.sync;

import static org.assertj.core.api.Assertions.assertThat;

import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.InMemoryDocumentStore;
import dev.haddaf.sync.web.DevelopmentIdTokenVerifier;
import dev.haddaf.sync.web.IdTokenVerifier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
    "firestore.enabled=false",
    "firebase.enabled=false",
    "sync.scheduled-checks.enabled=false"
})
class SyncApplicationTests {

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private IdTokenVerifier idTokenVerifier;

    @Test
    void contextLoads() {
    }

    @Test
    void fallsBackToLocalCollaboratorsWithoutGoogleCloud() {
        assertThat(documentStore).isInstanceOf(InMemoryDocumentStore.class);
        assertThat(idTokenVerifier).isInstanceOf(DevelopmentIdTokenVerifier.class);
    }
}
