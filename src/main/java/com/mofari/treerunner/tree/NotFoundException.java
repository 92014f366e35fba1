package com.mofari.treerunner.tree;

/**
 * 节点及其所有祖先的命名空间中都找不到指定键时抛出
 */
public class NotFoundException extends RuntimeException {

    private final String key;

    public NotFoundException(String key) {
        super("No such data item: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
