package me.christianrobert.bsontranspiler.transformer.builder;

import me.christianrobert.bsontranspiler.transformer.context.Translation;
import org.antlr.v4.runtime.tree.RuleNode;

/**
 * Default handler for node kinds without a dedicated rule (identifiers, member access,
 * calls, arithmetic and single-child wrappers such as {@code literal}).
 *
 * <ul>
 *   <li>One child: the child's translation is returned unchanged, type included.</li>
 *   <li>Several children: texts are concatenated without separator, type {@code UNKNOWN}.</li>
 *   <li>The first failing child is returned as the result.</li>
 * </ul>
 */
public class ChildrenTranslator {

  public Translation translate(RuleNode node, PythonCodeBuilder b) {
    int count = node.getChildCount();
    if (count == 1) {
      return b.visit(node.getChild(0));
    }

    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < count; i++) {
      Translation child = b.visit(node.getChild(i));
      if (child.isFailure()) {
        return child;
      }
      sb.append(child.getText());
    }
    return Translation.untyped(sb.toString());
  }
}
