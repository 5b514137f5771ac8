package io.github.plangc.test;

import io.github.plangc.core.ir.Category;
import io.github.plangc.core.symbols.*;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolTableTest {
    static Symbol sym(String name, String qualifiedName, SymbolKind kind) {
        return new Symbol(name, qualifiedName, kind, Category.CUSTOM, 0, Utils.loc());
    }

    @Test
    void testNearestRuleWins() {
        SymbolTable table = new SymbolTable();
        table.define(sym("p", "p", SymbolKind.POLICY));
        table.enterScope("p", Category.CUSTOM);
        Symbol outer = sym("check", "p.check", SymbolKind.RULE);
        table.define(outer);
        assertSame(outer, table.lookupRule("check"));

        table.enterScope("p.check", Category.CUSTOM);
        Symbol inner = sym("check", "p.check.check", SymbolKind.RULE);
        table.define(inner);
        assertEquals(2, table.depth());
        assertSame(inner, table.lookupRule("check"));

        table.exitScope();
        assertSame(outer, table.lookupRule("check"));
        table.exitScope();
        assertNull(table.lookupRule("check"));
        table.checkBalanced(Utils.loc());
    }

    @Test
    void testDuplicateMessageIgnoresDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            SymbolTable table = new SymbolTable();
            table.define(sym("p", "p", SymbolKind.POLICY));
            DuplicateSymbolException e = assertThrows(DuplicateSymbolException.class,
                    () -> table.define(sym("p", "p", SymbolKind.POLICY)));
            assertTrue(e.getMessage().contains("duplicate policy 'p'"), e.getMessage());
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void testDuplicateInSameScope() {
        SymbolTable table = new SymbolTable();
        Symbol first = sym("p", "p", SymbolKind.POLICY);
        table.define(first);
        Symbol second = sym("p", "p", SymbolKind.POLICY);
        DuplicateSymbolException e = assertThrows(DuplicateSymbolException.class, () -> table.define(second));
        assertSame(first, e.getExisting());
        assertEquals(second.location, e.getLocation());

        // a rule may share a policy's name
        table.define(sym("p", "p", SymbolKind.RULE));
    }

    @Test
    void testUnbalancedScopes() {
        SymbolTable table = new SymbolTable();
        assertThrows(UnbalancedScopeException.class, table::exitScope);

        table.enterScope("p", Category.SAFETY);
        assertThrows(UnbalancedScopeException.class, () -> table.checkBalanced(Utils.loc()));
        table.exitScope();
        table.checkBalanced(Utils.loc());
    }

    @Test
    void testReferences() {
        SymbolTable table = new SymbolTable();
        table.define(sym("p", "p", SymbolKind.POLICY));
        table.enterScope("p", Category.CUSTOM);
        Symbol used = sym("used", "p.used", SymbolKind.RULE);
        Symbol unused = sym("unused", "p.unused", SymbolKind.RULE);
        table.define(used);
        table.define(unused);

        assertSame(used, table.addReference("used", "p"));
        assertNull(table.addReference("ghost", "p"));
        table.exitScope();

        assertEquals(Collections.singleton("p"), used.getReferences());
        assertEquals(Collections.singletonList(new UnresolvedReference("ghost", "p")), table.unresolvedReferences());
        assertEquals(Collections.singletonList(unused), table.unreferencedRules());
        assertEquals(3, table.allSymbols().size());
    }

    @Test
    void testSetCurrentPriority() {
        SymbolTable table = new SymbolTable();
        Symbol policy = sym("p", "p", SymbolKind.POLICY);
        table.define(policy);
        table.enterScope("p", Category.CUSTOM);
        Symbol rule = sym("r", "p.r", SymbolKind.RULE);
        table.define(rule);

        table.setCurrentPriority(50);
        assertEquals(50, policy.getPriority());
        assertEquals(0, rule.getPriority());

        table.enterScope("p.r", Category.CUSTOM);
        table.setCurrentPriority(7);
        assertEquals(7, rule.getPriority());
        assertEquals(50, policy.getPriority());
    }
}
