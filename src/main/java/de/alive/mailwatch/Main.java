package de.alive.mailwatch;

import de.alive.mailwatch.exception.ConfigurationException;
import de.alive.mailwatch.exception.FatalSessionException;
import de.alive.mailwatch.service.ConfigurationService;
import de.alive.mailwatch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Main {

    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIGURATION = 3;

    public static void main(String[] args) {
        log.info("{} Starting mailwatch...", LogUtils.ROCKET_EMOJI);

        int status = 0;
        try {
            Configuration configuration = new ConfigurationService().loadConfiguration();
            new MailWatchApplication(configuration).run();
        } catch (ConfigurationException e) {
            log.error("{} Configuration error ({}): {}", LogUtils.ERROR_EMOJI, e.getConfigKey(), e.getMessage());
            status = EXIT_CONFIGURATION;
        } catch (FatalSessionException e) {
            log.error("{} Stopping: {}", LogUtils.ERROR_EMOJI, e.getMessage());
            status = e.getExitStatus();
        } catch (RuntimeException e) {
            log.error("{} Application failed: {}", LogUtils.ERROR_EMOJI, e.getMessage(), e);
            status = EXIT_FAILURE;
        }

        if (status != 0) {
            System.exit(status);
        }
    }
}
