package quest.gekko.smm.service.credential;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import quest.gekko.smm.config.MonitorProperties;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CredentialStoreTest {

    private CredentialStore credentialStore;

    @BeforeEach
    void setUp() {
        MonitorProperties properties = new MonitorProperties();
        properties.getCredentials().setUrl("jdbc:h2:mem:cookies-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        credentialStore = new CredentialStore(properties);
        credentialStore.init();
    }

    @AfterEach
    void tearDown() {
        credentialStore.close();
    }

    @Test
    void getReturnsAbsentWhenNothingWasSaved() {
        assertThat(credentialStore.get("douyin")).isEmpty();
    }

    @Test
    @DisplayName("Saving again replaces the previous token")
    void saveReplacesPreviousToken() {
        assertTrue(credentialStore.save("weibo", "SUB=first"));
        assertTrue(credentialStore.save("weibo", "SUB=second"));

        assertThat(credentialStore.get("weibo")).contains("SUB=second");
        assertThat(credentialStore.list()).hasSize(1);
    }

    @Test
    void tokensAreKeptPerPlatform() {
        credentialStore.save("weibo", "w");
        credentialStore.save("douyin", "d");

        assertThat(credentialStore.get("weibo")).contains("w");
        assertThat(credentialStore.get("douyin")).contains("d");
        assertThat(credentialStore.list()).extracting(StoredCredential::platform).containsExactly("douyin", "weibo");
    }

    @Test
    void deleteRemovesToken() {
        credentialStore.save("xiaohongshu", "a1=b2");

        assertTrue(credentialStore.delete("xiaohongshu"));
        assertThat(credentialStore.get("xiaohongshu")).isEmpty();
        assertFalse(credentialStore.delete("xiaohongshu"));
    }

    @Test
    void invalidInputIsRefused() {
        assertFalse(credentialStore.save("", "token"));
        assertFalse(credentialStore.save("weibo", null));
    }

    @Test
    @DisplayName("Storage failures are reported, not thrown")
    void failuresAreReportedThroughReturnValues() {
        credentialStore.close();

        assertFalse(credentialStore.save("weibo", "token"));
        assertThat(credentialStore.get("weibo")).isEmpty();
        assertFalse(credentialStore.delete("weibo"));
        assertThat(credentialStore.list()).isEmpty();
    }
}
