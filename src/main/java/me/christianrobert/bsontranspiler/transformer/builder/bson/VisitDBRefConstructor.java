package me.christianrobert.bsontranspiler.transformer.builder.bson;

import me.christianrobert.bsontranspiler.antlr.ECMAScriptParser;
import me.christianrobert.bsontranspiler.transformer.builder.PythonCodeBuilder;
import me.christianrobert.bsontranspiler.transformer.context.ErrorKind;
import me.christianrobert.bsontranspiler.transformer.context.Translation;
import me.christianrobert.bsontranspiler.transformer.type.SemanticType;

import java.util.List;

/**
 * {@code DBRef(namespace, id[, database])} translates unchanged once validated.
 *
 * <p>The id may be an object literal or an {@code ObjectId(...)}.</p>
 */
public class VisitDBRefConstructor {
  public static Translation v(ECMAScriptParser.BSONDBRefConstructorContext ctx, PythonCodeBuilder b) {
    if (!ConstructorArguments.hasArity(ctx.arguments(), 2, 3)) {
      return Translation.failure(ErrorKind.ARITY, "DBRef requires two or three arguments");
    }

    List<ECMAScriptParser.SingleExpressionContext> args = ConstructorArguments.of(ctx.arguments());

    Translation ns = b.visit(args.get(0));
    if (ns.isFailure()) {
      return ns;
    }
    if (ns.getType() != SemanticType.STRING) {
      return Translation.failure(ErrorKind.TYPE, "DBRef first argument requires string namespace");
    }

    Translation oid = b.visit(args.get(1));
    if (oid.isFailure()) {
      return oid;
    }
    if (!oid.getType().isOneOf(SemanticType.OBJECT, SemanticType.OBJECT_ID)) {
      return Translation.failure(ErrorKind.TYPE, "DBRef requires object OID");
    }

    if (args.size() == 3) {
      Translation db = b.visit(args.get(2));
      if (db.isFailure()) {
        return db;
      }
      if (db.getType() != SemanticType.STRING) {
        return Translation.failure(ErrorKind.TYPE, "DBRef requires string collection");
      }
      return Translation.success("DBRef(" + ns.getText() + ", " + oid.getText() + ", " + db.getText() + ")", SemanticType.DBREF);
    }

    return Translation.success("DBRef(" + ns.getText() + ", " + oid.getText() + ")", SemanticType.DBREF);
  }
}
