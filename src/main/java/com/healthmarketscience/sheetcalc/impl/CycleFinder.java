/*
Copyright (c) 2016 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.sheetcalc.impl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds the cycles (strongly connected components with more than one
 * member, or a single member which refers to itself) of a directed graph.
 *
 * @author James Ahlborn
 */
public abstract class CycleFinder<E>
{
  // https://en.wikipedia.org/wiki/Tarjan%27s_strongly_connected_components_algorithm

  private final Collection<E> _values;
  private final Map<E,Node<E>> _nodes = new IdentityHashMap<E,Node<E>>();
  private final List<List<E>> _cycles = new ArrayList<List<E>>();
  private final List<Node<E>> _stack = new ArrayList<Node<E>>();
  private int _index;

  protected CycleFinder(Collection<E> values) {
    _values = values;
  }

  /**
   * @return the cycles of the graph, each in discovery order
   */
  public List<List<E>> find() {

    for(E val : _values) {
      Node<E> node = getNode(val);
      if(node._index < 0) {
        visit(node);
      }
    }

    return _cycles;
  }

  private void visit(Node<E> root) {

    // iterative version of the classic recursive algorithm, formula chains
    // can be very long
    List<Frame<E>> frames = new ArrayList<Frame<E>>();
    start(root, frames);

    while(!frames.isEmpty()) {
      Frame<E> frame = frames.get(frames.size() - 1);
      Node<E> node = frame._node;

      if(frame._nextDesc < node._descs.size()) {
        Node<E> desc = getNode(node._descs.get(frame._nextDesc++));
        if(desc._index < 0) {
          start(desc, frames);
        } else if(desc._onStack) {
          node._lowLink = Math.min(node._lowLink, desc._index);
        }
        continue;
      }

      frames.remove(frames.size() - 1);
      if(!frames.isEmpty()) {
        Node<E> parent = frames.get(frames.size() - 1)._node;
        parent._lowLink = Math.min(parent._lowLink, node._lowLink);
      }

      if(node._lowLink == node._index) {
        popComponent(node);
      }
    }
  }

  private void start(Node<E> node, List<Frame<E>> frames) {
    node._index = _index;
    node._lowLink = _index;
    ++_index;
    _stack.add(node);
    node._onStack = true;
    frames.add(new Frame<E>(node));
  }

  private void popComponent(Node<E> root) {
    List<E> comp = new ArrayList<E>();
    Node<E> member = null;
    do {
      member = _stack.remove(_stack.size() - 1);
      member._onStack = false;
      comp.add(0, member._val);
    } while(member != root);

    if((comp.size() > 1) || root._descs.contains(root._val)) {
      _cycles.add(comp);
    }
  }

  private Node<E> getNode(E val) {
    Node<E> node = _nodes.get(val);
    if(node == null) {
      node = new Node<E>(val);
      getDescendents(val, node._descs);
      _nodes.put(val, node);
    }
    return node;
  }

  protected abstract void getDescendents(E from, List<E> descendents);


  private static class Node<E>
  {
    private final E _val;
    private final List<E> _descs = new ArrayList<E>();
    private int _index = -1;
    private int _lowLink;
    private boolean _onStack;

    private Node(E val) {
      _val = val;
    }
  }

  private static class Frame<E>
  {
    private final Node<E> _node;
    private int _nextDesc;

    private Frame(Node<E> node) {
      _node = node;
    }
  }
}
