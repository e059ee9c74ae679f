package nl.bytesoflife.kicadsexpr.drc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class DrcRuleSet {

    private int version = 1;
    private final List<DrcRule> rules = new ArrayList<>();

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public List<DrcRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void addRule(DrcRule rule) {
        rules.add(rule);
    }

    public boolean removeRule(String name) {
        return rules.removeIf(rule -> rule.getName().equals(name));
    }

    public Optional<DrcRule> getRule(String name) {
        return rules.stream().filter(rule -> rule.getName().equals(name)).findFirst();
    }

    public List<DrcRule> getRulesWithConstraint(ConstraintType type) {
        return rules.stream()
                .filter(rule -> rule.getConstraints().stream().anyMatch(c -> c.getType() == type))
                .toList();
    }

    @Override
    public String toString() {
        return "DrcRuleSet{version=" + version + ", rules=" + rules.size() + "}";
    }
}
