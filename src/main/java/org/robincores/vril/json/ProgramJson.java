package org.robincores.vril.json;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import org.robincores.vril.ir.ArrayElementId;
import org.robincores.vril.ir.ArrayOp;
import org.robincores.vril.ir.BoolLiteral;
import org.robincores.vril.ir.Const;
import org.robincores.vril.ir.EffectOp;
import org.robincores.vril.ir.Function;
import org.robincores.vril.ir.Init;
import org.robincores.vril.ir.Instruction;
import org.robincores.vril.ir.InstructionVisitor;
import org.robincores.vril.ir.IntLiteral;
import org.robincores.vril.ir.Label;
import org.robincores.vril.ir.Literal;
import org.robincores.vril.ir.LiteralInstruction;
import org.robincores.vril.ir.Names;
import org.robincores.vril.ir.Program;
import org.robincores.vril.ir.ScalarId;
import org.robincores.vril.ir.ValueOp;

/**
 * JSON interchange form of a program:
 * <pre>
 * {"functions": [{"name": "main", "instrs": [
 *   {"dest": "v", "op": "const", "type": "int", "value": 4},
 *   {"args": ["v"], "dest": "x", "op": "id", "type": "int"},
 *   {"args": ["x"], "op": "print"},
 *   {"label": "loop"}]}]}
 * </pre>
 * Keys come out sorted and the output is indented by two spaces.
 */
public final class ProgramJson {
  private static final Gson GSON = new GsonBuilder()
      .registerTypeAdapter(String.class, new StrictStringAdapter().nullSafe())
      .setPrettyPrinting()
      .disableHtmlEscaping()
      .create();

  private ProgramJson() {}

  // Gson binds these by field name; fields are declared in key order so output keys are sorted
  static final class ProgramData {
    List<FunctionData> functions;
  }

  static final class FunctionData {
    List<InstrData> instrs;
    String name;
  }

  static final class InstrData {
    List<String> args;
    String dest;
    String label;
    String op;
    String type;
    JsonElement value;
  }

  // Names must be JSON strings; Gson's default adapter would also take numbers and booleans
  static final class StrictStringAdapter extends TypeAdapter<String> {
    @Override
    public void write(JsonWriter out, String value) throws IOException {
      out.value(value);
    }

    @Override
    public String read(JsonReader in) throws IOException {
      JsonToken token = in.peek();
      if (token != JsonToken.STRING) {
        throw new JsonSyntaxException("Expected a string but was " + token + " at path " + in.getPath());
      }
      return in.nextString();
    }
  }

  public static String encode(Program program) {
    ProgramData data = new ProgramData();
    data.functions = new ArrayList<>();
    for (Function function : program.functions()) {
      FunctionData f = new FunctionData();
      f.name = function.name();
      f.instrs = new ArrayList<>();
      for (Instruction instr : function.instrs()) {
        f.instrs.add(instr.accept(ENCODER));
      }
      data.functions.add(f);
    }
    return GSON.toJson(data);
  }

  /**
   * @throws DecodeException if the text is not JSON or does not describe a program
   */
  public static Program decode(String json) {
    ProgramData data;
    // Gson.fromJson always reads leniently, so drive the adapter over a strict reader
    try (JsonReader reader = new JsonReader(new StringReader(json))) {
      reader.setLenient(false);
      data = GSON.getAdapter(ProgramData.class).read(reader);
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        throw new DecodeException("Malformed JSON: trailing data at path " + reader.getPath());
      }
    } catch (IOException | JsonParseException | IllegalStateException e) {
      throw new DecodeException("Malformed JSON: " + e.getMessage(), e);
    }
    if (data == null) {
      throw new DecodeException("Empty input");
    }
    if (data.functions == null) {
      throw new DecodeException("Missing 'functions'");
    }
    try {
      List<Function> functions = new ArrayList<>();
      for (FunctionData f : data.functions) {
        functions.add(function(f));
      }
      return new Program(functions);
    } catch (IllegalArgumentException e) {
      throw new DecodeException(e.getMessage(), e);
    }
  }

  static Function function(FunctionData f) {
    if (f == null) {
      throw new DecodeException("Function must be an object");
    }
    String name = require(f.name, "name", "function");
    List<Instruction> instrs = new ArrayList<>();
    if (f.instrs != null) {
      for (InstrData i : f.instrs) {
        instrs.add(instruction(i, name));
      }
    }
    return new Function(name, instrs);
  }

  static Instruction instruction(InstrData i, String function) {
    String where = "instruction in '" + function + "'";
    if (i == null) {
      throw new DecodeException("Each " + where + " must be an object");
    }
    if (i.label != null) {
      return new Label(new ScalarId(i.label));
    }
    String op = require(i.op, "op", where);
    if (op.equals(Const.OP) || op.equals(Init.OP)) {
      ScalarId dest = new ScalarId(require(i.dest, "dest", where));
      String type = require(i.type, "type", where);
      Literal value = literal(i.value, where);
      return op.equals(Const.OP) ? new Const(dest, type, value) : new Init(dest, type, value);
    }
    List<String> args = i.args != null ? i.args : new ArrayList<>();
    if (i.dest != null) {
      String type = require(i.type, "type", where);
      if (Names.hasBrackets(i.dest) || args.stream().anyMatch(a -> a != null && Names.hasBrackets(a))) {
        List<ArrayElementId> ids = new ArrayList<>();
        for (String arg : args) {
          ids.add(new ArrayElementId(require(arg, "args", where)));
        }
        return new ArrayOp(new ArrayElementId(i.dest), type, op, ids);
      }
      return new ValueOp(new ScalarId(i.dest), type, op, scalars(args, where));
    }
    return new EffectOp(op, scalars(args, where));
  }

  private static List<ScalarId> scalars(List<String> args, String where) {
    List<ScalarId> ids = new ArrayList<>();
    for (String arg : args) {
      ids.add(new ScalarId(require(arg, "args", where)));
    }
    return ids;
  }

  static Literal literal(JsonElement value, String where) {
    if (value == null || !value.isJsonPrimitive()) {
      throw new DecodeException("Missing or non-scalar 'value' in " + where);
    }
    JsonPrimitive p = value.getAsJsonPrimitive();
    if (p.isBoolean()) {
      return new BoolLiteral(p.getAsBoolean());
    }
    if (p.isNumber()) {
      try {
        return new IntLiteral(new BigDecimal(p.getAsString()).longValueExact());
      } catch (ArithmeticException | NumberFormatException e) {
        throw new DecodeException("Value " + p.getAsString() + " in " + where + " is not a 64-bit integer", e);
      }
    }
    throw new DecodeException("Value " + p + " in " + where + " is neither an integer nor a boolean");
  }

  private static <T> T require(T value, String key, String where) {
    if (value == null) {
      throw new DecodeException("Missing '" + key + "' in " + where);
    }
    return value;
  }

  private static final InstructionVisitor<InstrData> ENCODER = new InstructionVisitor<InstrData>() {
    @Override
    public InstrData visit(Label label) {
      InstrData d = new InstrData();
      d.label = label.name().name();
      return d;
    }

    @Override
    public InstrData visit(Const constant) {
      return literalInstruction(constant);
    }

    @Override
    public InstrData visit(Init init) {
      return literalInstruction(init);
    }

    @Override
    public InstrData visit(ValueOp op) {
      InstrData d = new InstrData();
      d.dest = op.dest().name();
      d.type = op.type();
      d.op = op.op();
      d.args = new ArrayList<>();
      for (ScalarId arg : op.args()) {
        d.args.add(arg.name());
      }
      return d;
    }

    @Override
    public InstrData visit(ArrayOp op) {
      InstrData d = new InstrData();
      d.dest = op.dest().name();
      d.type = op.type();
      d.op = op.op();
      d.args = new ArrayList<>();
      for (ArrayElementId arg : op.args()) {
        d.args.add(arg.name());
      }
      return d;
    }

    @Override
    public InstrData visit(EffectOp op) {
      InstrData d = new InstrData();
      d.op = op.op();
      d.args = new ArrayList<>();
      for (ScalarId arg : op.args()) {
        d.args.add(arg.name());
      }
      return d;
    }

    private InstrData literalInstruction(LiteralInstruction instr) {
      InstrData d = new InstrData();
      d.dest = instr.dest().name();
      d.type = instr.type();
      d.op = instr.op();
      Literal value = instr.value();
      d.value = value instanceof BoolLiteral
          ? new JsonPrimitive(((BoolLiteral) value).value())
          : new JsonPrimitive(((IntLiteral) value).value());
      return d;
    }
  };
}
