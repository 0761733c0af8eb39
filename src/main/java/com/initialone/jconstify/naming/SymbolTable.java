package com.initialone.jconstify.naming;

import com.initialone.jconstify.model.Binding;
import com.initialone.jconstify.model.LiteralOccurrence;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一次运行的符号表：字面量文本 -> Binding（按首次绑定顺序）。
 * SAFE 优先：先绑定全部 SAFE，再绑定 MANUAL；已绑定的文本不会再分配第二个名字。
 */
public class SymbolTable {
    private final IdentifierSynthesizer synthesizer;
    private final Map<String, Binding> bindings = new LinkedHashMap<>();

    public SymbolTable(IdentifierSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    /**
     * 绑定一批出现：SAFE 全部先于 MANUAL 处理，与传入顺序无关。
     */
    public void bindAll(Collection<LiteralOccurrence> occurrences) {
        for (LiteralOccurrence o : occurrences) {
            if (o.isSafe()) bind(o);
        }
        for (LiteralOccurrence o : occurrences) {
            if (!o.isSafe()) bind(o);
        }
    }

    /**
     * @return 该文本的绑定；已存在则原样返回，不消耗新名字
     */
    public Binding bind(LiteralOccurrence occurrence) {
        Binding existing = bindings.get(occurrence.text);
        if (existing != null) {
            return existing;
        }
        Binding b = new Binding(occurrence.text, synthesizer.synthesize(occurrence.text), occurrence);
        bindings.put(occurrence.text, b);
        return b;
    }

    public Optional<Binding> lookup(String literalText) {
        return Optional.ofNullable(bindings.get(literalText));
    }

    /** 全部绑定（SAFE ∪ MANUAL），按绑定顺序 */
    public Collection<Binding> all() {
        return Collections.unmodifiableCollection(bindings.values());
    }

    public List<Binding> safeBindings() {
        List<Binding> out = new ArrayList<>();
        for (Binding b : bindings.values()) if (b.isSafe()) out.add(b);
        return out;
    }

    public List<Binding> manualBindings() {
        List<Binding> out = new ArrayList<>();
        for (Binding b : bindings.values()) if (!b.isSafe()) out.add(b);
        return out;
    }

    public int size() {
        return bindings.size();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }
}
