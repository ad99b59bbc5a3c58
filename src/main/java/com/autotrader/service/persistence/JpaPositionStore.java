package com.autotrader.service.persistence;

import com.autotrader.model.Position;
import com.autotrader.model.PositionStatus;
import com.autotrader.repository.PositionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Position store backed by Spring Data JPA.
 * Writes are synchronous so that a state change is durable before the next tick sees it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaPositionStore implements PositionStore {

    private static final EnumSet<PositionStatus> ACTIVE_STATUSES =
            EnumSet.of(PositionStatus.OPEN, PositionStatus.PARTIALLY_CLOSED);

    private final PositionRepository positionRepository;
    private final PersistenceRecordMapper mapper;

    @Override
    @Transactional
    public void save(Position position) {
        positionRepository.save(mapper.toEntity(position));
        log.debug("Persisted position: id={}, status={}, remaining={}",
                position.getId(), position.getStatus(), position.getAmountRemaining());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Position> load(String id) {
        return positionRepository.findById(id).map(mapper::toPosition);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Position> loadAll() {
        return positionRepository.findAll().stream().map(mapper::toPosition).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Position> loadActive() {
        return positionRepository.findByStatusInOrderByEntryTimestampAsc(ACTIVE_STATUSES).stream()
                .map(mapper::toPosition)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Position> loadByStrategy(String strategyId) {
        return positionRepository.findByStrategyIdOrderByEntryTimestampDesc(strategyId).stream()
                .map(mapper::toPosition)
                .toList();
    }
}
