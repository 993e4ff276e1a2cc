package com.realm.generator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * 确定性随机源
 *
 * 生成器与模拟器的全部随机数都从这里取，不允许使用任何隐式全局随机。
 * 同一种子、同样顺序的调用序列得到逐位一致的结果。
 *
 * 内部记录底层抽取次数，存档时连同种子一起保存，
 * 读档后通过 {@link #restore(long, long)} 快进到同一位置继续。
 */
public class RandomSource {

    private final long seed;
    private final CountingRandom random;

    public RandomSource(long seed) {
        this.seed = seed;
        this.random = new CountingRandom(seed);
    }

    /**
     * 未指定种子时从系统熵取一次种子并记录下来，保证之后仍可存档复现
     */
    public static RandomSource fromSeed(Long seed) {
        return new RandomSource(seed != null ? seed : new Random().nextLong());
    }

    /**
     * 按种子重建并快进 draws 次底层抽取
     */
    public static RandomSource restore(long seed, long draws) {
        RandomSource source = new RandomSource(seed);
        for (long i = 0; i < draws; i++) {
            source.random.advance();
        }
        return source;
    }

    public long getSeed() {
        return seed;
    }

    /**
     * 已发生的底层抽取次数（流位置）
     */
    public long getDraws() {
        return random.draws;
    }

    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    /**
     * 闭区间 [min, max] 内的整数
     */
    public int randInt(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("区间非法: [" + min + ", " + max + "]");
        }
        return min + random.nextInt(max - min + 1);
    }

    public double nextDouble() {
        return random.nextDouble();
    }

    /**
     * 以概率 p 返回 true
     */
    public boolean chance(double p) {
        return random.nextDouble() < p;
    }

    public <T> T choice(List<T> options) {
        if (options == null || options.isEmpty()) {
            throw new IllegalArgumentException("候选列表为空");
        }
        return options.get(random.nextInt(options.size()));
    }

    /**
     * 无放回抽取 min(count, size) 个不同元素，保持抽取顺序
     */
    public <T> List<T> sample(Collection<T> population, int count) {
        List<T> pool = new ArrayList<>(population);
        int take = Math.max(0, Math.min(count, pool.size()));
        List<T> picked = new ArrayList<>(take);
        for (int i = 0; i < take; i++) {
            int index = random.nextInt(pool.size());
            picked.add(pool.remove(index));
        }
        return picked;
    }

    /**
     * 由随机流派生的UUID，保证实体ID同样可复现
     */
    public String nextUuid() {
        return new UUID(random.nextLong(), random.nextLong()).toString();
    }

    @Override
    public String toString() {
        return "RandomSource{seed=" + seed + ", draws=" + random.draws + "}";
    }

    /**
     * 统计 next(bits) 调用次数，Random 的所有公开方法最终都落到这里
     */
    private static final class CountingRandom extends Random {

        private static final long serialVersionUID = 1L;

        private long draws;

        CountingRandom(long seed) {
            super(seed);
        }

        @Override
        protected int next(int bits) {
            draws++;
            return super.next(bits);
        }

        void advance() {
            next(32);
        }
    }
}
