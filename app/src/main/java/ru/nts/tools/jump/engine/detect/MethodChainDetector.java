/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.jump.engine.detect;

import ru.nts.tools.jump.engine.CursorPosition;
import ru.nts.tools.jump.engine.JumpTarget;
import ru.nts.tools.jump.engine.SyntaxNode;

import java.util.Optional;

/**
 * Навигация по цепочке вызовов {@code obj.foo().bar().baz()}: между именами методов.
 * <p>
 * Структура звена:
 * <pre>
 * call_expression            .bar()
 *   member_expression        .bar
 *     call_expression        .foo() (предыдущее звено)
 *     property_identifier    bar
 * </pre>
 * Цепочка замкнута: на обоих концах шаг не выполняется.
 */
public class MethodChainDetector implements ConstructDetector<MethodChainDetector.ChainLink> {

    private static final int MAX_ASCENT = 10;

    /**
     * Звено цепочки: имя метода и вызов, которому оно принадлежит.
     */
    public record ChainLink(SyntaxNode property, SyntaxNode call) {}

    @Override
    public String name() {
        return "method-chain";
    }

    @Override
    public Optional<ChainLink> detect(SyntaxNode node, CursorPosition cursor) {
        SyntaxNode current = node;
        for (int depth = 0; current != null && depth < MAX_ASCENT; depth++) {
            if (current.is("property_identifier")) {
                break;
            }
            if (current.is("statement_block") || current.is("program")) {
                return Optional.empty();
            }
            current = current.parent();
        }
        if (current == null || !current.is("property_identifier")) {
            return Optional.empty();
        }

        SyntaxNode member = current.parent();
        if (member == null || !member.is("member_expression")) {
            return Optional.empty();
        }
        SyntaxNode call = member.parent();
        if (call == null || !call.is("call_expression") || !member.sameNode(callee(call))) {
            return Optional.empty();
        }

        if (hasNext(call) || previousCall(call) != null) {
            return Optional.of(new ChainLink(current, call));
        }
        return Optional.empty();
    }

    @Override
    public Optional<JumpTarget> step(ChainLink link, boolean forward) {
        if (forward) {
            SyntaxNode nextMember = link.call().parent();
            if (!hasNext(link.call())) {
                return Optional.empty();
            }
            SyntaxNode property = property(nextMember);
            return property != null ? Optional.of(JumpTarget.at(property)) : Optional.empty();
        }

        SyntaxNode previous = previousCall(link.call());
        if (previous == null) {
            return Optional.empty();
        }
        SyntaxNode property = property(callee(previous));
        return property != null ? Optional.of(JumpTarget.at(property)) : Optional.empty();
    }

    @Override
    public BoundaryPolicy boundaryPolicy() {
        return BoundaryPolicy.NO_OP;
    }

    /**
     * Вызов является объектом следующего обращения к методу, которое тоже вызывается.
     */
    private static boolean hasNext(SyntaxNode call) {
        SyntaxNode nextMember = call.parent();
        if (nextMember == null || !nextMember.is("member_expression")) {
            return false;
        }
        SyntaxNode nextCall = nextMember.parent();
        return nextCall != null && nextCall.is("call_expression") && nextMember.sameNode(callee(nextCall))
                && property(nextMember) != null;
    }

    /**
     * Предыдущий вызов цепочки: объект обращения к методу текущего вызова.
     */
    private static SyntaxNode previousCall(SyntaxNode call) {
        SyntaxNode member = callee(call);
        if (member == null || !member.is("member_expression")) {
            return null;
        }
        SyntaxNode object = member.fieldOrChild("object", 0);
        if (object == null || !object.is("call_expression")) {
            return null;
        }
        SyntaxNode previousMember = callee(object);
        if (previousMember == null || !previousMember.is("member_expression") || property(previousMember) == null) {
            return null;
        }
        return object;
    }

    private static SyntaxNode callee(SyntaxNode call) {
        return call == null ? null : call.fieldOrChild("function", 0);
    }

    private static SyntaxNode property(SyntaxNode member) {
        if (member == null) {
            return null;
        }
        SyntaxNode property = member.fieldOrChild("property", 2);
        return property != null && property.is("property_identifier") ? property : null;
    }
}
