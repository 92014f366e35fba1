package com.mofari.treerunner.loader;

import com.mofari.treerunner.tree.TestSuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 组装测试树：匿名根套件 + 每个 SuiteProvider 提供的分支
 */
@Component
public class TestTreeLoader {

    private static final Logger logger = LoggerFactory.getLogger(TestTreeLoader.class);

    @Autowired(required = false)
    private List<SuiteProvider> suiteProviders = new ArrayList<>();

    public TestSuite load() {
        TestSuite root = TestSuite.anonymous();
        for (SuiteProvider provider : suiteProviders) {
            root.addChild(provider.createSuite());
        }
        logger.info("测试树加载完成，分支数: {}，测试数: {}", root.getChildren().size(), root.tests().size());
        return root;
    }
}
