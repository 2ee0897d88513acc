/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.pregel.computation;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongConsumer;

import org.apache.pregel.comm.messages.Messenger;
import org.apache.pregel.conf.PregelConfig;
import org.apache.pregel.graph.Graph;
import org.apache.pregel.utils.AtomicBitSet;
import org.apache.pregel.values.NodeValue;

/**
 * Context of {@link PregelComputation#compute}.
 */
public class ComputeContext extends NodeCentricContext {
  /** Computation, for relationship weights */
  private final PregelComputation computation;
  /** Messenger */
  private final Messenger<?> messenger;
  /** Vote-to-halt bits */
  private final AtomicBitSet voteBits;
  /** Set when any vertex sends in this superstep */
  private final AtomicBoolean sentFlag;
  /** Current superstep */
  private final int superstep;
  /** Messages sent through this context */
  private long messagesSent;
  /** Scratch set for distinct neighbors */
  private LongOpenHashSet seen;

  /**
   * Constructor
   *
   * @param graph Graph
   * @param config Run configuration
   * @param nodeValue Value store
   * @param computation Computation
   * @param messenger Messenger
   * @param voteBits Vote-to-halt bits
   * @param sentFlag Shared "message sent" flag
   * @param superstep Current superstep
   */
  public ComputeContext(Graph graph, PregelConfig config, NodeValue nodeValue,
      PregelComputation computation, Messenger<?> messenger,
      AtomicBitSet voteBits, AtomicBoolean sentFlag, int superstep) {
    super(graph, config, nodeValue);
    this.computation = computation;
    this.messenger = messenger;
    this.voteBits = voteBits;
    this.sentFlag = sentFlag;
    this.superstep = superstep;
  }

  public int superstep() {
    return superstep;
  }

  public boolean isInitialSuperstep() {
    return superstep == 0;
  }

  public long relationshipCount() {
    return graph.relationshipCount();
  }

  public boolean isAsynchronous() {
    return config.isAsynchronous();
  }

  /**
   * @param key Property key
   * @return double value of the current vertex
   */
  public double doubleNodeValue(String key) {
    return nodeValue.doubleValue(key, nodeId);
  }

  /**
   * @param key Property key
   * @return long value of the current vertex
   */
  public long longNodeValue(String key) {
    return nodeValue.longValue(key, nodeId);
  }

  /**
   * @param key Property key
   * @return long array value of the current vertex
   */
  public long[] longArrayNodeValue(String key) {
    return nodeValue.longArrayValue(key, nodeId);
  }

  /**
   * @param key Property key
   * @return double array value of the current vertex
   */
  public double[] doubleArrayNodeValue(String key) {
    return nodeValue.doubleArrayValue(key, nodeId);
  }

  /**
   * Send a message, delivered in the next superstep.
   *
   * @param targetNodeId Receiver
   * @param message Message
   */
  public void sendTo(long targetNodeId, double message) {
    messenger.sendTo(nodeId, targetNodeId, message);
    ++messagesSent;
    if (!sentFlag.get()) {
      sentFlag.set(true);
    }
  }

  /**
   * Send a message along every outgoing relationship. On a weighted graph
   * the message is passed through
   * {@link PregelComputation#applyRelationshipWeight} first.
   *
   * @param message Message
   */
  public void sendToNeighbors(final double message) {
    if (graph.hasRelationshipProperty()) {
      graph.forEachRelationship(nodeId, 1.0, (source, target, weight) -> {
        sendTo(target, computation.applyRelationshipWeight(message, weight));
        return true;
      });
    } else {
      graph.forEachRelationship(nodeId, 1.0, (source, target, weight) -> {
        sendTo(target, message);
        return true;
      });
    }
  }

  /**
   * Visit the target of every outgoing relationship.
   *
   * @param consumer Callback
   */
  public void forEachNeighbor(final LongConsumer consumer) {
    graph.forEachRelationship(nodeId, 1.0, (source, target, weight) -> {
      consumer.accept(target);
      return true;
    });
  }

  /**
   * Visit every neighbor once, even with parallel relationships.
   *
   * @param consumer Callback
   */
  public void forEachDistinctNeighbor(final LongConsumer consumer) {
    if (seen == null) {
      seen = new LongOpenHashSet();
    } else {
      seen.clear();
    }
    graph.forEachRelationship(nodeId, 1.0, (source, target, weight) -> {
      if (seen.add(target)) {
        consumer.accept(target);
      }
      return true;
    });
  }

  /**
   * Stop participating until a message arrives.
   */
  public void voteToHalt() {
    voteBits.set(nodeId);
  }

  /**
   * @return Messages sent through this context so far
   */
  public long getMessagesSent() {
    return messagesSent;
  }
}
