package org.robincores.vril.json;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import org.robincores.vril.ir.ArrayOp;
import org.robincores.vril.ir.Const;
import org.robincores.vril.ir.EffectOp;
import org.robincores.vril.ir.Function;
import org.robincores.vril.ir.Init;
import org.robincores.vril.ir.Label;
import org.robincores.vril.ir.Literal;
import org.robincores.vril.ir.Program;
import org.robincores.vril.ir.ValueOp;

class ProgramJsonTest {

  private static final Program MAIN = Program.of(Function.of("main",
      Const.of("v", "int", Literal.of(4)),
      ValueOp.of("x", "int", "id", "v"),
      EffectOp.of("print", "x")));

  private static Program decodeOne(String instr) {
    return ProgramJson.decode("{\"functions\": [{\"name\": \"f\", \"instrs\": [" + instr + "]}]}");
  }

  // --- encode ---

  @Test void encodeSortsKeysAndIndentsByTwo() {
    String expected =
        "{\n" +
        "  \"functions\": [\n" +
        "    {\n" +
        "      \"instrs\": [\n" +
        "        {\n" +
        "          \"dest\": \"v\",\n" +
        "          \"op\": \"const\",\n" +
        "          \"type\": \"int\",\n" +
        "          \"value\": 4\n" +
        "        },\n" +
        "        {\n" +
        "          \"args\": [\n" +
        "            \"v\"\n" +
        "          ],\n" +
        "          \"dest\": \"x\",\n" +
        "          \"op\": \"id\",\n" +
        "          \"type\": \"int\"\n" +
        "        },\n" +
        "        {\n" +
        "          \"args\": [\n" +
        "            \"x\"\n" +
        "          ],\n" +
        "          \"op\": \"print\"\n" +
        "        }\n" +
        "      ],\n" +
        "      \"name\": \"main\"\n" +
        "    }\n" +
        "  ]\n" +
        "}";
    assertEquals(expected, ProgramJson.encode(MAIN));
  }

  @Test void encodeLabelAndBool() {
    String json = ProgramJson.encode(Program.of(Function.of("f",
        Label.of("loop"), Init.of("b", "bool", Literal.of(false)))));
    assertTrue(json.contains("\"label\": \"loop\""));
    assertTrue(json.contains("\"value\": false"));
    assertFalse(json.contains("\"args\""));
  }

  @Test void encodeThenDecode() {
    Program p = Program.of(Function.of("f",
        Label.of("top"),
        Init.of("a", "array", Literal.of(3)),
        ArrayOp.of("a[0]", "int", "v2a", "x"),
        ValueOp.of("y", "int", "nop"),
        EffectOp.of("ret")));
    assertEquals(p, ProgramJson.decode(ProgramJson.encode(p)));
  }

  // --- decode ---

  @Test void decodeScenario() {
    String json = "{\"functions\":[{\"name\":\"main\",\"instrs\":["
        + "{\"op\":\"const\",\"dest\":\"v\",\"type\":\"int\",\"value\":4},"
        + "{\"op\":\"id\",\"dest\":\"x\",\"type\":\"int\",\"args\":[\"v\"]},"
        + "{\"op\":\"print\",\"args\":[\"x\"]}]}]}";
    assertEquals(MAIN, ProgramJson.decode(json));
  }

  @Test void decodeSelectsVariant() {
    assertEquals(Label.of("l"), decodeOne("{\"label\": \"l\"}").functions().get(0).instrs().get(0));
    assertEquals(Init.of("b", "bool", Literal.of(true)),
        decodeOne("{\"op\": \"init\", \"dest\": \"b\", \"type\": \"bool\", \"value\": true}").functions().get(0).instrs().get(0));
    assertEquals(ArrayOp.of("x", "int", "a2v", "a[2]"),
        decodeOne("{\"op\": \"a2v\", \"dest\": \"x\", \"type\": \"int\", \"args\": [\"a[2]\"]}").functions().get(0).instrs().get(0));
    assertEquals(ValueOp.of("x", "int", "add", "a", "b"),
        decodeOne("{\"op\": \"add\", \"dest\": \"x\", \"type\": \"int\", \"args\": [\"a\", \"b\"]}").functions().get(0).instrs().get(0));
  }

  @Test void missingArgsMeansNoOperands() {
    assertEquals(EffectOp.of("ret"), decodeOne("{\"op\": \"ret\"}").functions().get(0).instrs().get(0));
  }

  @Test void unknownKeysAreIgnored() {
    Program p = ProgramJson.decode("{\"functions\": [{\"name\": \"f\", \"type\": \"int\", \"args\": [], \"instrs\": []}]}");
    assertEquals(Program.of(Function.of("f")), p);
  }

  @Test void malformedJson() {
    assertThrows(DecodeException.class, () -> ProgramJson.decode("{\"functions\": ["));
    assertThrows(DecodeException.class, () -> ProgramJson.decode("[1, 2]"));
    assertThrows(DecodeException.class, () -> ProgramJson.decode(""));
    assertThrows(DecodeException.class, () -> ProgramJson.decode("{\"functions\": []} {}"));
  }

  @Test void lenientSyntaxIsRejected() {
    assertThrows(DecodeException.class,
        () -> ProgramJson.decode("{functions: [{name: main, instrs: [{op: print, args: [x]}]}]}"));
    assertThrows(DecodeException.class,
        () -> ProgramJson.decode("{'functions': [{'name': 'main', 'instrs': []}]}"));
    assertThrows(DecodeException.class,
        () -> ProgramJson.decode("{\"functions\": [{\"name\": \"main\"; \"instrs\": []}]}"));
  }

  @Test void nonStringNamesAreRejected() {
    assertThrows(DecodeException.class, () -> decodeOne("{\"op\": true, \"args\": []}"));
    assertThrows(DecodeException.class, () -> decodeOne("{\"label\": true}"));
    assertThrows(DecodeException.class, () -> decodeOne("{\"op\": \"print\", \"args\": [1]}"));
    assertThrows(DecodeException.class,
        () -> decodeOne("{\"op\": \"id\", \"dest\": 7, \"type\": \"int\", \"args\": [\"a\"]}"));
    assertThrows(DecodeException.class,
        () -> decodeOne("{\"op\": \"id\", \"dest\": \"x\", \"type\": false, \"args\": [\"a\"]}"));
    assertThrows(DecodeException.class,
        () -> ProgramJson.decode("{\"functions\": [{\"name\": 5, \"instrs\": []}]}"));
    assertThrows(DecodeException.class, () -> ProgramJson.decode("{\"functions\": 5}"));
  }

  @Test void missingFields() {
    assertThrows(DecodeException.class, () -> ProgramJson.decode("{}"));
    assertThrows(DecodeException.class, () -> ProgramJson.decode("{\"functions\": [{\"instrs\": []}]}"));
    assertThrows(DecodeException.class, () -> decodeOne("{\"dest\": \"x\"}"));
    assertThrows(DecodeException.class, () -> decodeOne("{\"op\": \"const\", \"dest\": \"x\", \"type\": \"int\"}"));
    assertThrows(DecodeException.class, () -> decodeOne("{\"op\": \"add\", \"dest\": \"x\", \"args\": []}"));
  }

  @Test void badValues() {
    assertThrows(DecodeException.class,
        () -> decodeOne("{\"op\": \"const\", \"dest\": \"x\", \"type\": \"float\", \"value\": 1.5}"));
    assertThrows(DecodeException.class,
        () -> decodeOne("{\"op\": \"const\", \"dest\": \"x\", \"type\": \"int\", \"value\": \"4\"}"));
    assertThrows(DecodeException.class,
        () -> decodeOne("{\"op\": \"const\", \"dest\": \"x\", \"type\": \"int\", \"value\": 1e30}"));
  }

  @Test void badNames() {
    DecodeException e = assertThrows(DecodeException.class, () -> decodeOne("{\"op\": \"print\", \"args\": [\"a b\"]}"));
    assertTrue(e.getMessage().contains("a b"));
    assertThrows(DecodeException.class, () -> decodeOne("{\"op\": \"print\", \"args\": [\"a[0]\"]}"));
    assertThrows(DecodeException.class, () -> decodeOne("{\"label\": \"l[0]\"}"));
  }
}
