package com.wshg.synergy.service;

import com.wshg.synergy.config.SynergyProperties;
import com.wshg.synergy.domain.Device;
import com.wshg.synergy.domain.DevicePath;
import com.wshg.synergy.domain.PathSearchOptions;
import com.wshg.synergy.embedding.EmbeddingModel;
import com.wshg.synergy.embedding.VectorMath;
import com.wshg.synergy.store.DeviceEmbeddingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;

/**
 * 多跳链路发现：以触发设备为起点做限深广度优先搜索，每一跳只扩展相似度最高的 topK 个未访问设备。
 * 链路包含 maxDepth 个设备时评分，达到接受阈值才保留。
 * 每个触发设备独立并行遍历同一份只读向量快照，各自有遍历时限，超时返回已接受的链路。
 */
@Slf4j
@Service
public class ChainPathFinder {

    /** 排序：评分降序，再按触发设备、完整路径升序，保证结果确定 */
    static final Comparator<DevicePath> RANKING = Comparator
            .comparingDouble(DevicePath::getScore).reversed()
            .thenComparing(DevicePath::getTriggerDeviceId)
            .thenComparing(p -> String.join("|", p.getDeviceIds()));

    private final DeviceEmbeddingStore embeddingStore;
    private final EmbeddingModel embeddingModel;
    private final PathScorer pathScorer;
    private final SynergyProperties props;
    private final ExecutorService traversalExecutor;

    public ChainPathFinder(DeviceEmbeddingStore embeddingStore,
                           EmbeddingModel embeddingModel,
                           PathScorer pathScorer,
                           SynergyProperties props,
                           @Qualifier("traversalExecutor") ExecutorService traversalExecutor) {
        this.embeddingStore = embeddingStore;
        this.embeddingModel = embeddingModel;
        this.pathScorer = pathScorer;
        this.props = props;
        this.traversalExecutor = traversalExecutor;
    }

    /**
     * @param triggers 触发设备（链路起点）
     * @param catalog  参与遍历的设备目录，提供区域与类别信息
     * @param options  最大设备数、最低相似度、每跳保留数
     * @return 按评分排序的链路，可能为空
     */
    public List<DevicePath> findPaths(Collection<Device> triggers, Collection<Device> catalog, PathSearchOptions options) {
        if (triggers == null || triggers.isEmpty()) return List.of();
        Map<String, Node> snapshot = snapshot(catalog);
        log.info("[链路发现] 开始, 触发设备数={}, 可遍历设备数={}, maxDepth={}, minSimilarity={}, topK={}",
                triggers.size(), snapshot.size(), options.maxDepth(), options.minSimilarity(), options.topKPerHop());

        Duration timeout = props.getPathTimeout();
        Map<String, Future<List<DevicePath>>> futures = new LinkedHashMap<>();
        for (Device trigger : triggers) {
            if (trigger == null || futures.containsKey(trigger.getDeviceId())) continue;
            Node start = snapshot.get(trigger.getDeviceId());
            if (start == null) {
                log.warn("[链路发现] 触发设备无可用向量, 跳过 deviceId={}", trigger.getDeviceId());
                continue;
            }
            futures.put(trigger.getDeviceId(),
                    traversalExecutor.submit(() -> searchFrom(start, snapshot.values(), options, timeout)));
        }

        List<DevicePath> results = new ArrayList<>();
        for (Map.Entry<String, Future<List<DevicePath>>> e : futures.entrySet()) {
            try {
                results.addAll(e.getValue().get(timeout.toMillis() + 1_000, TimeUnit.MILLISECONDS));
            } catch (TimeoutException ex) {
                e.getValue().cancel(true);
                log.warn("[链路发现] 触发设备遍历未按时结束, 已取消 deviceId={}", e.getKey());
            } catch (ExecutionException ex) {
                log.error("[链路发现] 触发设备遍历失败 deviceId={}", e.getKey(), ex.getCause());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("[链路发现] 等待遍历结果时被中断, 返回已完成部分");
                break;
            }
        }
        results.sort(RANKING);
        log.info("[链路发现] 完成, 链路数={}", results.size());
        return results;
    }

    /**
     * 当前模型版本下新鲜、且在目录中的设备向量快照。遍历期间只读。
     */
    private Map<String, Node> snapshot(Collection<Device> catalog) {
        Map<String, float[]> vectors = embeddingStore.all();
        String version = embeddingModel.version();
        Duration maxAge = props.getEmbeddingMaxAge();
        Map<String, Node> nodes = new LinkedHashMap<>();
        int stale = 0;
        if (catalog == null) return nodes;
        for (Device d : catalog) {
            if (d == null || d.getDeviceId() == null) continue;
            float[] v = vectors.get(d.getDeviceId());
            if (v == null) continue;
            if (!embeddingStore.isFresh(d.getDeviceId(), version, maxAge)) {
                stale++;
                continue;
            }
            nodes.put(d.getDeviceId(), new Node(d, v));
        }
        if (stale > 0) {
            log.warn("[链路发现] {} 个设备向量已过期或版本不一致, 不参与遍历, 请先重新生成向量", stale);
        }
        return nodes;
    }

    List<DevicePath> searchFrom(Node start, Collection<Node> nodes, PathSearchOptions options, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        double floor = props.getPathAcceptanceFloor();
        List<DevicePath> accepted = new ArrayList<>();
        Deque<Frontier> queue = new ArrayDeque<>();
        queue.add(new Frontier(List.of(start), List.of()));
        int expanded = 0;

        while (!queue.isEmpty()) {
            if (System.nanoTime() - deadline >= 0 || Thread.currentThread().isInterrupted()) {
                log.warn("[链路发现] 触发设备 {} 遍历超时, 放弃剩余 {} 个节点, 已接受链路数={}",
                        start.id(), queue.size(), accepted.size());
                break;
            }
            Frontier f = queue.poll();
            if (f.nodes().size() == options.maxDepth()) {
                DevicePath path = f.toPath();
                double score = pathScorer.score(path);
                if (score >= floor) accepted.add(path.toBuilder().score(score).build());
                continue;
            }
            expanded++;
            for (Hop hop : nextHops(f, nodes, options)) {
                queue.add(f.extend(hop));
            }
        }
        log.debug("[链路发现] 触发设备 {} 扩展节点数={}, 接受链路数={}", start.id(), expanded, accepted.size());
        return accepted;
    }

    /**
     * 对所有未访问设备计算相似度，保留不低于阈值的前 topK 个。
     */
    private List<Hop> nextHops(Frontier f, Collection<Node> nodes, PathSearchOptions options) {
        Node current = f.last();
        Set<String> visited = f.visitedIds();
        List<Hop> candidates = new ArrayList<>();
        for (Node n : nodes) {
            if (visited.contains(n.id())) continue;
            if (n.vector().length != current.vector().length) continue;
            double sim = similarity(current, n);
            if (sim >= options.minSimilarity()) candidates.add(new Hop(n, sim));
        }
        candidates.sort(Comparator.comparingDouble(Hop::similarity).reversed()
                .thenComparing(h -> h.node().id()));
        return candidates.size() > options.topKPerHop() ? candidates.subList(0, options.topKPerHop()) : candidates;
    }

    /** 归一化向量点积 + 同区域加成，上限 1 */
    double similarity(Node a, Node b) {
        double sim = VectorMath.dot(a.vector(), b.vector());
        if (a.device().sharesAreaWith(b.device())) sim += props.getSameAreaBonus();
        return Math.min(1.0, sim);
    }

    record Node(Device device, float[] vector) {
        String id() {
            return device.getDeviceId();
        }
    }

    record Hop(Node node, double similarity) {
    }

    record Frontier(List<Node> nodes, List<Double> hops) {

        Node last() {
            return nodes.get(nodes.size() - 1);
        }

        Set<String> visitedIds() {
            Set<String> ids = new HashSet<>();
            for (Node n : nodes) ids.add(n.id());
            return ids;
        }

        Frontier extend(Hop hop) {
            List<Node> nextNodes = new ArrayList<>(nodes);
            nextNodes.add(hop.node());
            List<Double> nextHops = new ArrayList<>(hops);
            nextHops.add(hop.similarity());
            return new Frontier(nextNodes, nextHops);
        }

        DevicePath toPath() {
            DevicePath.DevicePathBuilder b = DevicePath.builder();
            for (Node n : nodes) b.device(n.device());
            return b.hopSimilarities(hops).build();
        }
    }
}
