package com.autotrader.service.persistence;

import com.autotrader.model.Strategy;
import com.autotrader.repository.StrategyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Strategy store backed by Spring Data JPA.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaStrategyStore implements StrategyStore {

    private final StrategyRepository strategyRepository;
    private final PersistenceRecordMapper mapper;

    @Override
    @Transactional
    public void save(Strategy strategy) {
        strategyRepository.save(mapper.toEntity(strategy));
        log.debug("Persisted strategy: id={}, name={}", strategy.getId(), strategy.getName());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Strategy> load(String id) {
        return strategyRepository.findById(id).map(mapper::toStrategy);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Strategy> loadAll() {
        return strategyRepository.findAllByOrderByCreatedAtAsc().stream().map(mapper::toStrategy).toList();
    }

    @Override
    @Transactional
    public void delete(String id) {
        strategyRepository.deleteById(id);
        log.debug("Deleted strategy: id={}", id);
    }
}
