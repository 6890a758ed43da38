package com.pickem.service;

import com.pickem.config.PickemRuntimeProperties;
import com.pickem.model.GameType;
import com.pickem.model.GameTypeCatalog;
import com.pickem.repository.GameTypeRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReferenceDataBootstrapServiceTest {

    @Mock
    private GameTypeRepository gameTypeRepository;

    @Mock
    private GameTypeScalingService gameTypeScalingService;

    @Mock
    private TeamIngestionService teamIngestionService;

    @Test
    void run_seedsMissingGameTypesAndScaling() {
        PickemRuntimeProperties properties = new PickemRuntimeProperties();
        ReferenceDataBootstrapService bootstrap = new ReferenceDataBootstrapService(
                gameTypeRepository, gameTypeScalingService, teamIngestionService, properties);
        when(gameTypeRepository.existsById(anyString())).thenReturn(false);
        when(gameTypeRepository.existsById("REG")).thenReturn(true);

        bootstrap.run(null);

        ArgumentCaptor<GameType> captor = ArgumentCaptor.forClass(GameType.class);
        verify(gameTypeRepository, times(GameTypeCatalog.values().length - 1)).save(captor.capture());
        List<String> seeded = captor.getAllValues().stream().map(GameType::getId).toList();
        assertEquals(List.of("WC", "DIV", "CON", "SB"), seeded);
        assertEquals("Super Bowl", captor.getAllValues().get(3).getName());
        verify(gameTypeScalingService).seedMissingScaling();
        verify(teamIngestionService, never()).refreshTeams();
    }

    @Test
    void run_refreshesTeamsWhenConfigured() {
        PickemRuntimeProperties properties = new PickemRuntimeProperties();
        properties.getIngestion().setRefreshTeamsOnStartup(true);
        ReferenceDataBootstrapService bootstrap = new ReferenceDataBootstrapService(
                gameTypeRepository, gameTypeScalingService, teamIngestionService, properties);
        when(gameTypeRepository.existsById(anyString())).thenReturn(true);
        when(teamIngestionService.refreshTeams()).thenReturn(new BatchReport("team-ingestion"));

        bootstrap.run(null);

        verify(gameTypeRepository, never()).save(any(GameType.class));
        verify(teamIngestionService).refreshTeams();
    }
}
