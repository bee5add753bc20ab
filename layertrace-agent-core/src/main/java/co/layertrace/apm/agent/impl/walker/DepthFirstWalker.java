/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package co.layertrace.apm.agent.impl.walker;

import co.layertrace.apm.agent.impl.layer.Layer;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Pre-order, depth-first traversal of a layer tree.
 * <p>
 * For every layer, the {@link #before(Consumer) before hook} is invoked first, then the {@link LayerVisitor},
 * then all children are walked, and finally the {@link #after(Consumer) after hook} is invoked.
 * </p>
 * <p>
 * The walker keeps no state between walks apart from the hooks, every walk starts over at the root.
 * The tree must not be modified while it is walked.
 * </p>
 */
public class DepthFirstWalker {

    @Nullable
    private final Layer root;
    @Nullable
    private Consumer<Layer> beforeHook;
    @Nullable
    private Consumer<Layer> afterHook;

    public DepthFirstWalker(@Nullable Layer root) {
        this.root = root;
    }

    public DepthFirstWalker before(Consumer<Layer> beforeHook) {
        this.beforeHook = beforeHook;
        return this;
    }

    public DepthFirstWalker after(Consumer<Layer> afterHook) {
        this.afterHook = afterHook;
        return this;
    }

    /**
     * Walks the whole tree.
     */
    public void forEach(Consumer<Layer> visitor) {
        walk(layer -> {
            visitor.accept(layer);
            return null;
        });
    }

    /**
     * Walks the tree until the visitor returns a non-null result.
     * The after hooks of the layers which are still open when the walk terminates early are not invoked.
     *
     * @return the first non-null result of the visitor, or {@code null} if the whole tree has been walked
     */
    @Nullable
    public <T> T walk(LayerVisitor<T> visitor) {
        if (root == null) {
            return null;
        }
        T result = enter(root, visitor);
        if (result != null) {
            return result;
        }
        final Deque<Position> stack = new ArrayDeque<>();
        stack.push(new Position(root));
        while (!stack.isEmpty()) {
            final Position position = stack.peek();
            final List<Layer> children = position.layer.getChildren();
            if (position.nextChild < children.size()) {
                final Layer child = children.get(position.nextChild++);
                result = enter(child, visitor);
                if (result != null) {
                    return result;
                }
                stack.push(new Position(child));
            } else {
                stack.pop();
                if (afterHook != null) {
                    afterHook.accept(position.layer);
                }
            }
        }
        return null;
    }

    /**
     * @return the first layer in pre-order which matches the predicate, or {@code null}
     */
    @Nullable
    public Layer findFirst(Predicate<Layer> predicate) {
        return walk(layer -> predicate.test(layer) ? layer : null);
    }

    @Nullable
    private <T> T enter(Layer layer, LayerVisitor<T> visitor) {
        if (beforeHook != null) {
            beforeHook.accept(layer);
        }
        return visitor.visit(layer);
    }

    private static class Position {
        private final Layer layer;
        private int nextChild;

        private Position(Layer layer) {
            this.layer = layer;
        }
    }
}
