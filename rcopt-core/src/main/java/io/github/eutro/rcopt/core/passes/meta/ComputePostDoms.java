package io.github.eutro.rcopt.core.passes.meta;

import io.github.eutro.rcopt.core.ext.CommonExts;
import io.github.eutro.rcopt.core.ext.Ext;
import io.github.eutro.rcopt.core.ext.MetadataState;
import io.github.eutro.rcopt.core.passes.InPlaceIRPass;
import io.github.eutro.rcopt.core.ssa.BasicBlock;
import io.github.eutro.rcopt.core.ssa.Function;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/*
 Thomas Lengauer and Robert Endre Tarjan. A fast algorithm for finding dominators in a flow-graph.
 ACM Transactions on Programming Languages and Systems, 1(1):121-141, July 1979.
*/

/**
 * Compute the {@link CommonExts#IPDOM immediate post-dominator} of every block in a function.
 * <p>
 * Dominators are computed on the reversed control flow graph, rooted at a virtual exit node
 * which every block without jump targets flows into. Blocks post-dominated only by the virtual exit,
 * and blocks that cannot reach an exit at all, get no {@link CommonExts#IPDOM}.
 * The order of the function's blocks is left as is.
 */
public class ComputePostDoms implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePostDoms INSTANCE = new ComputePostDoms();

    // node 1 is the virtual exit, block i is node i + 2
    private static final int EXIT = 1;
    private static final int FIRST_BLOCK = 2;

    @Override
    public void runInPlace(Function func) {
        computePostDoms(func);
    }

    private static void computePostDoms(Function func) {
        class Runner {
            int n = func.blocks.size() + 1;
            final int[][] succ = new int[n + 1][];
            final int[] dom = new int[n + 1];
            final int[] parent = new int[n + 1];
            final int[] ancestor = new int[n + 1];
            final int[] child = new int[n + 1];
            final int[] vertex = new int[n + 1];
            final int[] label = new int[n + 1];
            final int[] semi = new int[n + 1];
            final int[] size = new int[n + 1];
            @SuppressWarnings("unchecked")
            final Set<Integer>[] pred = new Set[n + 1];
            @SuppressWarnings("unchecked")
            final Set<Integer>[] bucket = new Set[n + 1];

            void dfs(int v) {
                semi[v] = ++n;
                vertex[n] = label[v] = v;
                ancestor[v] = child[v] = 0;
                size[v] = 1;
                for (int w : succ[v]) {
                    if (semi[w] == 0) {
                        parent[w] = v;
                        dfs(w);
                    }
                    pred[w].add(v);
                }
            }

            void compress(int v) {
                if (ancestor[ancestor[v]] != 0) {
                    compress(ancestor[v]);
                    if (semi[label[ancestor[v]]] < semi[label[v]]) {
                        label[v] = label[ancestor[v]];
                    }
                    ancestor[v] = ancestor[ancestor[v]];
                }
            }

            int eval(int v) {
                if (ancestor[v] == 0) {
                    return label[v];
                } else {
                    compress(v);
                    return semi[label[ancestor[v]]] >= semi[label[v]]
                            ? label[v]
                            : label[ancestor[v]];
                }
            }

            void link(int v, int w) {
                int s = w;
                while (semi[label[w]] < semi[label[child[s]]]) {
                    if (size[s] + size[child[child[s]]] >= 2 * size[child[s]]) {
                        ancestor[child[s]] = s;
                        child[s] = child[child[s]];
                    } else {
                        size[child[s]] = size[s];
                        s = ancestor[s] = child[s];
                    }
                }
                label[s] = label[w];
                size[v] += size[w];
                if (size[v] < 2 * size[w]) {
                    int t = s;
                    s = child[v];
                    child[v] = t;
                }
                while (s != 0) {
                    ancestor[s] = v;
                    s = child[s];
                }
            }

            void buildReverseGraph(Ext<Integer> indexExt) {
                @SuppressWarnings("unchecked")
                List<Integer>[] reverse = new List[n + 1];
                for (int v = 1; v <= n; v++) {
                    reverse[v] = new ArrayList<>();
                }
                for (BasicBlock block : func.blocks) {
                    int v = block.getExtOrThrow(indexExt);
                    List<BasicBlock> targets = block.getControl().targets;
                    if (targets.isEmpty()) {
                        reverse[EXIT].add(v);
                    }
                    for (BasicBlock target : targets) {
                        reverse[target.getExtOrThrow(indexExt)].add(v);
                    }
                }
                for (int v = 1; v <= n; v++) {
                    succ[v] = reverse[v].stream().mapToInt(Integer::intValue).toArray();
                }
            }

            void run() {
                Ext<Integer> indexExt = Ext.create(Integer.class, "index");
                int u, w;
                for (int i = 0; i < func.blocks.size(); i++) {
                    func.blocks.get(i).attachExt(indexExt, i + FIRST_BLOCK);
                }
                buildReverseGraph(indexExt);

                for (int v = 1; v <= n; ++v) {
                    pred[v] = new HashSet<>();
                    bucket[v] = new HashSet<>();
                    semi[v] = 0;
                }
                n = 0;
                dfs(EXIT);
                size[0] = label[0] = semi[0] = 0;
                for (int i = n; i >= 2; i--) {
                    w = vertex[i];
                    for (int v : pred[w]) {
                        u = eval(v);
                        if (semi[u] < semi[w]) {
                            semi[w] = semi[u];
                        }
                    }
                    bucket[vertex[semi[w]]].add(w);
                    link(parent[w], w);
                    for (int v : bucket[parent[w]]) {
                        u = eval(v);
                        dom[v] = semi[u] < semi[v] ? u : parent[w];
                    }
                    bucket[parent[w]].clear();
                }
                for (int i = 2; i <= n; ++i) {
                    w = vertex[i];
                    if (dom[w] != vertex[semi[w]]) {
                        dom[w] = dom[dom[w]];
                    }
                }
                dom[EXIT] = 0;

                for (int i = 0; i < func.blocks.size(); i++) {
                    BasicBlock block = func.blocks.get(i);
                    block.removeExt(indexExt);
                    block.removeExt(CommonExts.IPDOM);
                    int v = i + FIRST_BLOCK;
                    // unvisited blocks never reach an exit
                    if (semi[v] != 0 && dom[v] >= FIRST_BLOCK) {
                        block.attachExt(CommonExts.IPDOM, func.blocks.get(dom[v] - FIRST_BLOCK));
                    }
                }
            }
        }
        new Runner().run();

        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.validate(MetadataState.POST_DOMS);
    }
}
