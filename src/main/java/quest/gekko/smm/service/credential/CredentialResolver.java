package quest.gekko.smm.service.credential;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import quest.gekko.smm.config.MonitorProperties;

/**
 * Picks the token for a request: the caller's own token, else the stored one, else the
 * configured fallback (possibly empty). Evaluated per request so a refreshed token is
 * picked up on the next call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialResolver {

    private final CredentialStore credentialStore;
    private final MonitorProperties properties;

    public String resolve(String platformCode, String directToken) {
        if (StringUtils.hasText(directToken)) {
            return directToken;
        }
        String stored = credentialStore.get(platformCode).filter(StringUtils::hasText).orElse(null);
        if (stored != null) {
            return stored;
        }
        String fallback = properties.platform(platformCode).getCredential();
        if (!StringUtils.hasText(fallback)) {
            log.debug("No credential for {}, sending unauthenticated request", platformCode);
            return "";
        }
        return fallback;
    }
}
