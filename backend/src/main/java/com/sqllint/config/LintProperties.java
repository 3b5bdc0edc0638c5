package com.sqllint.config;

import com.sqllint.model.LayoutConfig;
import com.sqllint.model.LinePosition;
import com.sqllint.model.SegmentType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * sqllint.* 配置项
 */
@Getter
@ConfigurationProperties(prefix = "sqllint")
public class LintProperties {

    /** 单次检查最多收集的违规数 */
    @Setter
    private int maxViolations = 1000;

    private Rules rules = new Rules();

    private Fix fix = new Fix();

    private Layout layout = new Layout();

    public void setRules(Rules rules) {
        this.rules = (rules == null) ? new Rules() : rules;
    }

    public void setFix(Fix fix) {
        this.fix = (fix == null) ? new Fix() : fix;
    }

    public void setLayout(Layout layout) {
        this.layout = (layout == null) ? new Layout() : layout;
    }

    public LayoutConfig toLayoutConfig() {
        return new LayoutConfig(layout.getLinePositions());
    }

    // ---- nested: rules ----
    public static final class Rules {
        private List<String> exclude = new ArrayList<>();

        public List<String> getExclude() {
            return Collections.unmodifiableList(exclude);
        }

        public void setExclude(List<String> exclude) {
            this.exclude = new ArrayList<>(Objects.requireNonNullElse(exclude, List.of()));
        }
    }

    // ---- nested: fix ----
    public static final class Fix {
        /** lint -> 修复 的最大循环轮数 */
        @Getter
        @Setter
        private int runawayLimit = 10;
    }

    // ---- nested: layout ----
    public static final class Layout {
        private Map<String, LinePosition> linePositions = defaultLinePositions();

        public Map<String, LinePosition> getLinePositions() {
            return Collections.unmodifiableMap(linePositions);
        }

        public void setLinePositions(Map<String, LinePosition> linePositions) {
            Map<String, LinePosition> merged = defaultLinePositions();
            merged.putAll(Objects.requireNonNullElse(linePositions, Map.of()));
            this.linePositions = merged;
        }

        private static Map<String, LinePosition> defaultLinePositions() {
            Map<String, LinePosition> defaults = new LinkedHashMap<>();
            defaults.put(SegmentType.SET_OPERATOR, LinePosition.ALONE);
            return defaults;
        }
    }
}
