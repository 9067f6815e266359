package com.cgraph.model.par;

import com.cgraph.model.ConversionException;
import com.cgraph.model.ir.IrGraph;
import com.cgraph.model.ir.IrNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParMappingTest {

    private static ParGraph sample() {
        return ParGraph.of(
                ParNode.atomic("a"),
                ParNode.parallel(
                        ParNode.atomic("b"),
                        ParNode.sequence(ParNode.atomic("c"), ParNode.parallel(ParNode.atomic("d"), ParNode.atomic("e")))),
                ParNode.atomic("f"));
    }

    @Test
    void parToIrAndBackIsLossless() {
        ParGraph par = sample();
        IrGraph ir = ParMapping.toIr(par);

        assertEquals("$a,{b,[c,{d,e}]},f$", ir.toString());
        assertEquals(par, ParMapping.fromIr(ir));
    }

    @Test
    void plainIrSurvivesParRoundTrip() {
        IrGraph ir = IrGraph.of(IrNode.sequence(IrNode.atomic("x"), IrNode.parallel()), IrNode.atomic("y"));
        assertEquals(ir, ParMapping.toIr(ParMapping.fromIr(ir)));
    }

    @Test
    void dependenciesCannotBeRepresented() {
        IrGraph ir = IrGraph.of(IrNode.atomic("a"), IrNode.parallel(IrNode.dependent("b", "a")));
        ConversionException e = assertThrows(ConversionException.class, () -> ParMapping.fromIr(ir));
        assertTrue(e.getMessage().contains("cannot represent"));
        assertTrue(e.getMessage().contains("'b'"));
    }

    @Test
    void terminalCannotBeRepresented() {
        IrGraph ir = IrGraph.of(IrNode.sequence(IrNode.terminal("x"), IrNode.atomic("y")));
        assertThrows(ConversionException.class, () -> ParMapping.fromIr(ir));
    }

    @Test
    void writesIndentedParText() {
        String expected = """
                begin
                  a
                  parbegin
                    b
                    begin
                      c
                      parbegin
                        d
                        e
                      parend
                    end
                  parend
                  f
                end""";
        assertEquals(expected, ParNotation.write(sample()));
        assertEquals("begin\nend", ParNotation.write(new ParGraph(List.of())));
    }
}
