package com.daoindexer.config;

import com.daoindexer.domain.Setting;
import com.daoindexer.domain.SettingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IndexerSettingsGuardTest {

    @Mock
    private SettingRepository settingRepository;

    private IndexerProperties properties;
    private IndexerSettingsGuard guard;

    @BeforeEach
    void setUp() {
        properties = new IndexerProperties();
        properties.setMasterAddress("EQmaster");
        properties.setMainnet(true);
        guard = new IndexerSettingsGuard(properties, settingRepository);
    }

    @Test
    @DisplayName("first start stores the configured master address")
    void firstStartStoresMaster() {
        when(settingRepository.findById(Setting.MASTER_ADDRESS)).thenReturn(Optional.empty());

        guard.checkMasterAddress();

        ArgumentCaptor<Setting> saved = ArgumentCaptor.forClass(Setting.class);
        verify(settingRepository).save(saved.capture());
        assertThat(saved.getValue().getId()).isEqualTo(Setting.MASTER_ADDRESS);
        assertThat(saved.getValue().getStringValue()).isEqualTo("EQmaster");
    }

    @Test
    @DisplayName("same master address on restart is accepted")
    void sameMasterAccepted() {
        when(settingRepository.findById(Setting.MASTER_ADDRESS))
                .thenReturn(Optional.of(Setting.ofString(Setting.MASTER_ADDRESS, "EQmaster")));

        guard.checkMasterAddress();

        verify(settingRepository, never()).save(any(Setting.class));
    }

    @Test
    @DisplayName("changed master address fails startup")
    void changedMasterFails() {
        when(settingRepository.findById(Setting.MASTER_ADDRESS))
                .thenReturn(Optional.of(Setting.ofString(Setting.MASTER_ADDRESS, "EQother")));

        assertThatThrownBy(guard::checkMasterAddress)
                .isInstanceOf(IndexerConfigurationException.class)
                .hasMessageContaining("Master contract changed");
    }

    @Test
    @DisplayName("blank master address fails before the store is read")
    void blankMasterFails() {
        properties.setMasterAddress(" ");

        assertThatThrownBy(guard::checkMasterAddress).isInstanceOf(IndexerConfigurationException.class);
        verify(settingRepository, never()).findById(any());
    }

    @Test
    @DisplayName("network type is stored once and must not change")
    void mainnetCheck() {
        when(settingRepository.findById(Setting.IN_MAINNET)).thenReturn(Optional.empty());
        guard.checkMainnet();
        verify(settingRepository).save(any(Setting.class));

        when(settingRepository.findById(Setting.IN_MAINNET))
                .thenReturn(Optional.of(Setting.ofBool(Setting.IN_MAINNET, false)));
        assertThatThrownBy(guard::checkMainnet)
                .isInstanceOf(IndexerConfigurationException.class)
                .hasMessageContaining("Net type changed");
    }
}
