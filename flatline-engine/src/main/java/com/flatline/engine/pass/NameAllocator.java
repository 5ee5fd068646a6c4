package com.flatline.engine.pass;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 命名分配器：单个编译单元内单调递增的计数器
 *
 * <p>生成的名字形如 {@code __name_N}。每次展开运行持有自己的实例。
 * 调用方已经使用的名字通过 {@link #reserve} 登记，分配时跳过。</p>
 */
public final class NameAllocator {

    private static final Pattern GENERATED = Pattern.compile("__(.+)_\\d+");

    private final Set<String> reserved = new HashSet<String>();
    private int counter;

    public int next() {
        return ++counter;
    }

    public void reserve(Collection<String> names) {
        reserved.addAll(names);
    }

    public boolean isReserved(String name) {
        return reserved.contains(name);
    }

    /**
     * 分配新名字；base 本身是生成的名字时取其原始部分，
     * 得到 {@code __x_7} 而不是 {@code ____x_3_7}
     */
    public String fresh(String base) {
        String root = baseOf(base);
        String name;
        do {
            name = "__" + root + "_" + next();
        } while (reserved.contains(name));
        return name;
    }

    public int current() {
        return counter;
    }

    static String baseOf(String name) {
        String root = name;
        Matcher m = GENERATED.matcher(root);
        while (m.matches()) {
            root = m.group(1);
            m = GENERATED.matcher(root);
        }
        return root;
    }
}
