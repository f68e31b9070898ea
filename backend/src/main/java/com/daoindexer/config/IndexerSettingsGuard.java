package com.daoindexer.config;

import com.daoindexer.domain.Setting;
import com.daoindexer.domain.SettingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Startup check of the configured master address and network type against the stored settings.
 * The first start stores them; any later start with different values fails until the database is erased.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IndexerSettingsGuard implements InitializingBean {

    private final IndexerProperties properties;
    private final SettingRepository settingRepository;

    @Override
    public void afterPropertiesSet() {
        checkMasterAddress();
        checkMainnet();
    }

    void checkMasterAddress() {
        String master = properties.getMasterAddress();
        if (master == null || master.isBlank()) {
            throw new IndexerConfigurationException("Master contract address not set (daoindexer.master-address)");
        }

        Optional<Setting> saved = settingRepository.findById(Setting.MASTER_ADDRESS);
        if (saved.isEmpty()) {
            settingRepository.save(Setting.ofString(Setting.MASTER_ADDRESS, master));
        } else if (!master.equals(saved.get().getStringValue())) {
            log.error("Master contract mismatch: saved {}, configured {}. Erase db to start with new master address!",
                    saved.get().getStringValue(), master);
            throw new IndexerConfigurationException("Master contract changed");
        }
        log.info("Master contract address: {}", master);
    }

    void checkMainnet() {
        boolean mainnet = properties.isMainnet();

        Optional<Setting> saved = settingRepository.findById(Setting.IN_MAINNET);
        if (saved.isEmpty() || saved.get().getBoolValue() == null) {
            settingRepository.save(Setting.ofBool(Setting.IN_MAINNET, mainnet));
        } else if (saved.get().getBoolValue() != mainnet) {
            log.error("Net type mismatch: saved {}, configured {}. Erase db to start with new net type!",
                    netName(saved.get().getBoolValue()), netName(mainnet));
            throw new IndexerConfigurationException("Net type changed");
        }
        log.info("Net type: {}", netName(mainnet));
    }

    private static String netName(boolean mainnet) {
        return mainnet ? "MAINnet" : "TESTnet";
    }
}
