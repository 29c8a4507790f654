package com.callflow.infrastructure.repository.run;

import com.callflow.domain.run.adapter.repository.IPipelineRunRepository;
import com.callflow.domain.run.model.entity.PipelineRunEntity;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 流水线运行仓储实现类。
 * 运行聚合是进程内的活对象（自身同步），此处保存实例引用而非副本；
 * 写入序号用于同一时刻创建的运行之间稳定排序。
 *
 * @author callflow
 * @since 2026-10-01
 */
@Repository
public class PipelineRunRepositoryImpl implements IPipelineRunRepository {

    private final Map<String, PipelineRunEntity> runs = new ConcurrentHashMap<>();
    private final Map<String, Long> sequence = new ConcurrentHashMap<>();
    private final AtomicLong nextSequence = new AtomicLong();

    @Override
    public PipelineRunEntity save(PipelineRunEntity run) {
        sequence.computeIfAbsent(run.getId(), id -> nextSequence.incrementAndGet());
        runs.put(run.getId(), run);
        return run;
    }

    @Override
    public PipelineRunEntity findById(String runId) {
        return runId == null ? null : runs.get(runId);
    }

    @Override
    public List<PipelineRunEntity> findAll() {
        return runs.values().stream()
                .sorted(Comparator.comparing((PipelineRunEntity run) -> sequence.getOrDefault(run.getId(), 0L)).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public boolean deleteById(String runId) {
        if (runId == null) {
            return false;
        }
        sequence.remove(runId);
        return runs.remove(runId) != null;
    }
}
