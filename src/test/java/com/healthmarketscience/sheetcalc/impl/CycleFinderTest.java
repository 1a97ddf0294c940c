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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import junit.framework.TestCase;

/**
 *
 * @author James Ahlborn
 */
public class CycleFinderTest extends TestCase
{

  public CycleFinderTest(String name) {
    super(name);
  }

  public void testNoCycles() throws Exception
  {
    assertEquals(Collections.emptyList(),
                 findCycles(Arrays.asList("A", "B", "C")));

    assertEquals(Collections.emptyList(),
                 findCycles(Arrays.asList("A", "B", "C", "D"),
                            "A", "B",
                            "B", "C",
                            "A", "C",
                            "D", "A"));
  }

  public void testCycles() throws Exception
  {
    assertEquals(Arrays.asList(Arrays.asList("A")),
                 findCycles(Arrays.asList("A", "B"),
                            "A", "A",
                            "A", "B"));

    assertEquals(Arrays.asList(Arrays.asList("A", "B", "C")),
                 findCycles(Arrays.asList("A", "B", "C", "D"),
                            "A", "B",
                            "B", "C",
                            "C", "A",
                            "C", "D"));

    // two independent cycles joined by a one way edge
    List<List<String>> cycles = findCycles(
        Arrays.asList("A", "B", "C", "D", "E"),
        "A", "B",
        "B", "A",
        "B", "C",
        "C", "D",
        "D", "C",
        "E", "E");
    assertEquals(3, cycles.size());
    assertEquals(Arrays.asList("C", "D"), cycles.get(0));
    assertEquals(Arrays.asList("A", "B"), cycles.get(1));
    assertEquals(Arrays.asList("E"), cycles.get(2));
  }

  public void testLongChain() throws Exception
  {
    // deep enough to overflow the stack of a recursive search
    List<String> vals = new ArrayList<String>();
    List<String> descs = new ArrayList<String>();
    for(int i = 0; i < 100000; ++i) {
      vals.add("V" + i);
      if(i > 0) {
        descs.add(vals.get(i - 1));
        descs.add(vals.get(i));
      }
    }
    assertEquals(Collections.emptyList(),
                 findCycles(vals, descs.toArray(new String[descs.size()])));

    descs.add(vals.get(vals.size() - 1));
    descs.add(vals.get(0));
    List<List<String>> cycles = findCycles(
        vals, descs.toArray(new String[descs.size()]));
    assertEquals(1, cycles.size());
    assertEquals(vals, cycles.get(0));
  }

  private static List<List<String>> findCycles(List<String> values,
                                               String... descs)
  {
    final Map<String,List<String>> descMap =
      new HashMap<String,List<String>>();
    for(int i = 0; i < descs.length; i+=2) {
      List<String> vals = descMap.get(descs[i]);
      if(vals == null) {
        vals = new ArrayList<String>();
        descMap.put(descs[i], vals);
      }
      vals.add(descs[i+1]);
    }

    return new CycleFinder<String>(values) {
      @Override
      protected void getDescendents(String from, List<String> descendents) {
        List<String> vals = descMap.get(from);
        if(vals != null) {
          descendents.addAll(vals);
        }
      }
    }.find();
  }
}
